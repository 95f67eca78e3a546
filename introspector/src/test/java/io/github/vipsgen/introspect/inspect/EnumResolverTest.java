package io.github.vipsgen.introspect.inspect;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.vipsgen.introspect.config.TestConfigs;
import io.github.vipsgen.introspect.runtime.FakeRuntime;
import io.github.vipsgen.ir.EnumDescriptor;
import io.github.vipsgen.ir.EnumValue;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnumResolverTest {

    private FakeRuntime runtime;
    private EnumResolver resolver;

    @BeforeEach
    void setUp() {
        runtime = FakeRuntime.withVipsBaseTypes();
        runtime.type("VipsKernel", "GEnum")
                .value("VIPS_KERNEL_NEAREST", "nearest", 0)
                .value("VIPS_KERNEL_LINEAR", "linear", 1)
                .value("VIPS_KERNEL_CUBIC", "cubic", 2)
                .value("VIPS_KERNEL_LAST", "last", 3);
        runtime.type("VipsForeignKeep", "GFlags")
                .value("VIPS_FOREIGN_KEEP_NONE", "none", 0)
                .value("VIPS_FOREIGN_KEEP_EXIF", "exif", 1);
        resolver = new EnumResolver(runtime, runtime, TestConfigs.standard());
    }

    @Test
    void resolvesValuesInDeclaredOrderWithoutSentinel() {
        EnumDescriptor kernel = resolver.resolve("VipsKernel");

        assertThat(kernel.getTypeName()).isEqualTo("VipsKernel");
        assertThat(kernel.hasValues()).isTrue();
        assertThat(kernel.getValues()).containsExactly(
                new EnumValue("VIPS_KERNEL_NEAREST", "nearest", 0),
                new EnumValue("VIPS_KERNEL_LINEAR", "linear", 1),
                new EnumValue("VIPS_KERNEL_CUBIC", "cubic", 2));
    }

    @Test
    void sentinelIsDroppedWhereverItAppears() {
        runtime.type("VipsOddEnum", "GEnum")
                .value("VIPS_ODD_LAST", "last", 0)
                .value("VIPS_ODD_ONE", "one", 1);

        assertThat(resolver.resolve("VipsOddEnum").getValues())
                .extracting(EnumValue::getNick)
                .containsExactly("one");
    }

    @Test
    void enumWithOnlySentinelHasNoValues() {
        runtime.type("VipsEmptyEnum", "GEnum").value("VIPS_EMPTY_LAST", "last", 0);

        EnumDescriptor empty = resolver.resolve("VipsEmptyEnum");

        assertThat(empty.getTypeName()).isEqualTo("VipsEmptyEnum");
        assertThat(empty.hasValues()).isFalse();
    }

    @Test
    void unknownNameYieldsEmptyDescriptor() {
        EnumDescriptor missing = resolver.resolve("VipsNoSuchEnum");

        assertThat(missing.getTypeName()).isEqualTo("VipsNoSuchEnum");
        assertThat(missing.getValues()).isEmpty();
        assertThat(missing.hasValues()).isFalse();
    }

    @Test
    void flagsTypeYieldsEmptyDescriptor() {
        assertThat(resolver.resolve("VipsForeignKeep").getValues()).isEmpty();
    }

    @Test
    void nonEnumTypeYieldsEmptyDescriptor() {
        assertThat(resolver.resolve("VipsImage").getValues()).isEmpty();
    }

    @Test
    void missingNamesBecomeEmptyStrings() {
        runtime.type("VipsAnon", "GEnum").value(null, null, 7);

        assertThat(resolver.resolve("VipsAnon").getValues()).containsExactly(new EnumValue("", "", 7));
    }

    @Test
    void resolvesAllInRequestedOrder() {
        List<EnumDescriptor> resolved = resolver.resolveAll(List.of("VipsNoSuchEnum", "VipsKernel"));

        assertThat(resolved).extracting(EnumDescriptor::getTypeName).containsExactly("VipsNoSuchEnum", "VipsKernel");
        assertThat(resolved.get(1).getValues()).hasSize(3);
    }
}
