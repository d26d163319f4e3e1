package com.hal9001.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.hal9001.backend.modules.permission.domain.PermissionGrant;
import com.hal9001.backend.modules.permission.domain.PermissionGrantId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionGrantRepository extends JpaRepository<PermissionGrant, PermissionGrantId> {

    List<PermissionGrant> findByIdUserIdOrderByIdResourceNameAsc(String userId);

    Optional<PermissionGrant> findByIdUserIdAndIdResourceName(String userId, String resourceName);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PermissionGrant pg where pg.id.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}
