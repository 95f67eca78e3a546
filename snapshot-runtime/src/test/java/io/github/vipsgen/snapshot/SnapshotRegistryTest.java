package io.github.vipsgen.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.github.vipsgen.introspect.IntrospectionException;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.Fundamental;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotRegistryTest {

    private SnapshotRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = SnapshotRegistry.build(Snapshots.parse("{'types': ["
                + "{'name': 'GObject', 'fundamental': 'object'},"
                + "{'name': 'GEnum', 'fundamental': 'enum', 'abstract': true},"
                + "{'name': 'VipsKernel', 'parent': 'GEnum'},"
                + "{'name': 'VipsObject', 'parent': 'GObject', 'abstract': true},"
                + "{'name': 'VipsImage', 'parent': 'VipsObject'},"
                + "{'name': 'VipsOperation', 'parent': 'VipsObject', 'abstract': true},"
                + "{'name': 'VipsConversion', 'parent': 'VipsOperation', 'abstract': true},"
                + "{'name': 'VipsCopy', 'parent': 'VipsConversion', 'nickname': 'copy'},"
                + "{'name': 'VipsEmbed', 'parent': 'VipsConversion', 'nickname': 'embed'},"
                + "{'name': 'VipsAbs', 'parent': 'VipsOperation', 'nickname': 'abs'}"
                + "]}"));
    }

    @Test
    void walksSubtypesDepthFirstInRegistrationOrder() {
        List<String> visited = new ArrayList<>();
        registry.forEachSubtype(registry.typeFromName("VipsOperation"), type -> visited.add(type.name()));

        assertThat(visited).containsExactly("VipsConversion", "VipsCopy", "VipsEmbed", "VipsAbs");
    }

    @Test
    void answersHierarchyQueries() {
        ForeignType copy = registry.typeFromName("VipsCopy");

        assertThat(registry.parentOf(copy).name()).isEqualTo("VipsConversion");
        assertThat(registry.parentOf(registry.typeFromName("GObject"))).isNull();
        assertThat(registry.shortName(copy)).isEqualTo("copy");
        assertThat(registry.shortName(registry.typeFromName("VipsOperation"))).isNull();
        assertThat(registry.isAbstract(registry.typeFromName("VipsConversion"))).isTrue();
        assertThat(registry.isAbstract(copy)).isFalse();
        assertThat(registry.typeFromName("VipsMissing")).isNull();
    }

    @Test
    void inheritsFundamentalFromNearestAncestor() {
        assertThat(registry.typeFromName("VipsKernel").fundamental()).isEqualTo(Fundamental.ENUM);
        assertThat(registry.typeFromName("VipsKernel").isEnum()).isTrue();
        assertThat(registry.typeFromName("VipsImage").fundamental()).isEqualTo(Fundamental.OBJECT);
        assertThat(registry.typeFromName("VipsImage").isImageHandle()).isTrue();
        assertThat(registry.typeFromName("VipsCopy").isImageHandle()).isFalse();
    }

    @Test
    void rejectsForeignTypes() {
        ForeignType stranger = mock(ForeignType.class);

        assertThatThrownBy(() -> registry.isAbstract(stranger)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> SnapshotRegistry.build(Snapshots.parse(
                        "{'types': [{'name': 'GObject'}, {'name': 'GObject'}]}")))
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("registered twice");
    }

    @Test
    void rejectsUnregisteredParent() {
        assertThatThrownBy(() -> SnapshotRegistry.build(Snapshots.parse(
                        "{'types': [{'name': 'VipsImage', 'parent': 'VipsObject'}]}")))
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("VipsObject");
    }

    @Test
    void rejectsUnknownFundamental() {
        assertThatThrownBy(() -> SnapshotRegistry.build(Snapshots.parse(
                        "{'types': [{'name': 'gquad', 'fundamental': 'quad'}]}")))
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("quad");
    }

    @Test
    void rejectsCyclicHierarchy() {
        assertThatThrownBy(() -> SnapshotRegistry.build(Snapshots.parse("{'types': ["
                        + "{'name': 'A', 'parent': 'B'},"
                        + "{'name': 'B', 'parent': 'A'}"
                        + "]}")))
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("cyclic");
    }
}
