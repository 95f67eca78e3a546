package io.github.vipsgen.introspect;

import static io.github.vipsgen.introspect.runtime.ForeignArgumentFlags.CONSTRUCT;
import static io.github.vipsgen.introspect.runtime.ForeignArgumentFlags.INPUT;
import static io.github.vipsgen.introspect.runtime.ForeignArgumentFlags.OUTPUT;
import static io.github.vipsgen.introspect.runtime.ForeignArgumentFlags.REQUIRED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.vipsgen.introspect.config.TestConfigs;
import io.github.vipsgen.introspect.runtime.FakeRuntime;
import io.github.vipsgen.ir.ArgKind;
import io.github.vipsgen.ir.ArgumentDescriptor;
import io.github.vipsgen.ir.EnumDescriptor;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IntrospectorTest {

    private FakeRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = FakeRuntime.withVipsBaseTypes();
        runtime.type("VipsKernel", "GEnum")
                .value("VIPS_KERNEL_NEAREST", "nearest", 0)
                .value("VIPS_KERNEL_LINEAR", "linear", 1)
                .value("VIPS_KERNEL_LAST", "last", 2);
        runtime.type("VipsResample", "VipsOperation").setAbstract();
        runtime.type("VipsResize", "VipsResample")
                .nickname("resize")
                .description("resize an image")
                .argument(runtime.plain("in", "VipsImage"), INPUT | REQUIRED | CONSTRUCT, 1)
                .argument(runtime.plain("out", "VipsImage"), OUTPUT | REQUIRED | CONSTRUCT, 2)
                .argument(runtime.doubleSpec("scale", "gdouble", 1, 0, 10000000), INPUT | REQUIRED | CONSTRUCT, 3)
                .argument(runtime.enumSpec("kernel", "VipsKernel", 5), INPUT | CONSTRUCT, 4);
        runtime.type("VipsAbs", "VipsOperation")
                .nickname("abs")
                .argument(runtime.plain("in", "VipsImage"), INPUT | REQUIRED | CONSTRUCT, 1)
                .argument(runtime.plain("out", "VipsImage"), OUTPUT | REQUIRED | CONSTRUCT, 2);
    }

    @Test
    void discoversSortedOperations() throws Exception {
        IntrospectionResult result;
        try (Introspector introspector = Introspector.open(runtime, TestConfigs.standard())) {
            result = introspector.introspect();
        }

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("abs", "resize");
        OperationDescriptor resize = result.operation("resize").orElseThrow();
        assertThat(resize.getCategory()).isEqualTo("resample");
        assertThat(resize.getDescription()).isEqualTo("resize an image");
        assertThat(resize.requiredInputs()).extracting(ArgumentDescriptor::getName).containsExactly("in", "scale");
        assertThat(resize.optionalInputs()).extracting(ArgumentDescriptor::getName).containsExactly("kernel");
        assertThat(resize.outputs()).extracting(ArgumentDescriptor::getName).containsExactly("out");
        ArgumentDescriptor kernel = resize.argument("kernel").orElseThrow();
        assertThat(kernel.getKind()).isEqualTo(ArgKind.ENUM);
        assertThat(kernel.getDefaultValue()).isEqualTo(5.0);
        assertThat(kernel.getEnumTypeName()).isEqualTo("VipsKernel");
        assertThat(result.operation("abs").orElseThrow().getCategory()).isEqualTo("abs");
    }

    @Test
    void resolvesReferencedEnums() throws Exception {
        try (Introspector introspector = Introspector.open(runtime, TestConfigs.standard())) {
            IntrospectionResult result = introspector.introspect();
            List<EnumDescriptor> enums = introspector.introspectEnums(EnumReferences.collect(result.getOperations()));

            assertThat(enums).extracting(EnumDescriptor::getTypeName).containsExactly("VipsKernel");
            assertThat(enums.get(0).getValues()).hasSize(2);
            assertThat(introspector.introspectEnum("VipsUnknown").getValues()).isEmpty();
        }
    }

    @Test
    void repeatedRunsGiveEqualResults() throws Exception {
        try (Introspector introspector = Introspector.open(runtime, TestConfigs.standard())) {
            IntrospectionResult first = introspector.introspect();
            IntrospectionResult second = introspector.introspect();

            assertThat(second.getOperations()).isEqualTo(first.getOperations());
        }
        assertThat(runtime.liveInstances()).isZero();
    }

    @Test
    void closeShutsRuntimeDown() throws Exception {
        Introspector introspector = Introspector.open(runtime, TestConfigs.standard());
        assertThat(runtime.initCalls()).isEqualTo(1);
        assertThat(runtime.isShutDown()).isFalse();

        introspector.close();

        assertThat(runtime.isShutDown()).isTrue();
    }

    @Test
    void initializationFailureIsFatal() {
        runtime.failInitWith("vips_init failed");

        assertThatThrownBy(() -> Introspector.open(runtime, TestConfigs.standard()))
                .isInstanceOf(IntrospectionException.class)
                .hasMessage("vips_init failed");
        assertThat(runtime.instantiations()).isZero();
    }

    @Test
    void unknownProviderIsReported() {
        assertThatThrownBy(() -> Introspector.findProvider("libvips-native"))
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("libvips-native");
    }
}
