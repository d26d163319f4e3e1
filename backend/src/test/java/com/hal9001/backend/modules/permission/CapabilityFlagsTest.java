package com.hal9001.backend.modules.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hal9001.backend.modules.permission.domain.Capability;
import com.hal9001.backend.modules.permission.domain.CapabilityFlags;
import com.hal9001.backend.modules.permission.domain.ManagedResourceCatalog;

import org.junit.jupiter.api.Test;

class CapabilityFlagsTest {

    @Test
    void eachFlagMapsToItsCapability() {
        CapabilityFlags flags = new CapabilityFlags(true, false, true, false);

        assertThat(flags.allows(Capability.SELECT)).isTrue();
        assertThat(flags.allows(Capability.INSERT)).isFalse();
        assertThat(flags.allows(Capability.UPDATE)).isTrue();
        assertThat(flags.allows(Capability.DELETE)).isFalse();
    }

    @Test
    void noneAllowsNothing() {
        for (Capability capability : Capability.values()) {
            assertThat(CapabilityFlags.NONE.allows(capability)).isFalse();
        }
    }

    @Test
    void catalogKeepsConfiguredOrderAndTrimsNames() {
        ManagedResourceCatalog catalog = new ManagedResourceCatalog(" b_table , a_table,,b_table ");

        assertThat(catalog.list()).containsExactly("b_table", "a_table");
        assertThat(catalog.contains("a_table")).isTrue();
        assertThat(catalog.contains("c_table")).isFalse();
        assertThat(catalog.contains(null)).isFalse();
    }

    @Test
    void emptyCatalogIsAConfigurationError() {
        assertThatThrownBy(() -> new ManagedResourceCatalog(" , "))
                .isInstanceOf(IllegalStateException.class);
    }
}
