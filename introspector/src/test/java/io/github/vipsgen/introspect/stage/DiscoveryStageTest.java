package io.github.vipsgen.introspect.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.vipsgen.introspect.IntrospectionException;
import io.github.vipsgen.introspect.config.TestConfigs;
import io.github.vipsgen.introspect.inspect.OperationInspector;
import io.github.vipsgen.introspect.runtime.FakeRuntime;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DiscoveryStageTest {

    @Mock
    private OperationInspector inspector;

    private FakeRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = FakeRuntime.withVipsBaseTypes();
    }

    @Test
    void describesConcreteNamedSubtypesInRegistryOrder() throws Exception {
        runtime.type("VipsArithmetic", "VipsOperation").setAbstract();
        runtime.type("VipsAdd", "VipsArithmetic").nickname("add");
        runtime.type("VipsAbs", "VipsArithmetic").nickname("abs");
        runtime.type("VipsCopy", "VipsOperation").nickname("copy");
        when(inspector.inspect(any(), anyString()))
                .thenAnswer(call -> Optional.of(operation(call.getArgument(1))));

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("add", "abs", "copy");
        assertThat(result.getVisitedTypes()).isEqualTo(4);
        assertThat(result.getSkippedTypes()).isZero();
        verify(inspector, never()).inspect(eq(runtime.get("VipsArithmetic")), anyString());
    }

    @Test
    void ignoresTypesWithoutShortName() throws Exception {
        runtime.type("VipsNameless", "VipsOperation");

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).isEmpty();
        assertThat(result.getVisitedTypes()).isEqualTo(1);
        verify(inspector, never()).inspect(any(), anyString());
    }

    @Test
    void ignoresTypesWithEmptyShortName() throws Exception {
        runtime.type("VipsOdd", "VipsOperation").nickname("");
        runtime.type("VipsInvert", "VipsOperation").nickname("invert");
        when(inspector.inspect(runtime.get("VipsInvert"), "invert")).thenReturn(Optional.of(operation("invert")));

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("invert");
        verify(inspector, never()).inspect(eq(runtime.get("VipsOdd")), anyString());
    }

    @Test
    void invalidDescriptorDoesNotHideTheRest() throws Exception {
        runtime.type("VipsMalformed", "VipsOperation").nickname("malformed");
        runtime.type("VipsFine", "VipsOperation").nickname("fine");
        when(inspector.inspect(runtime.get("VipsMalformed"), "malformed"))
                .thenThrow(new IllegalArgumentException("Operation 'malformed' has an empty category"));
        when(inspector.inspect(runtime.get("VipsFine"), "fine")).thenReturn(Optional.of(operation("fine")));

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("fine");
        assertThat(result.getSkippedTypes()).isEqualTo(1);
    }

    @Test
    void countsTypesThatCannotBeDescribed() throws Exception {
        runtime.type("VipsBroken", "VipsOperation").nickname("broken");
        runtime.type("VipsFine", "VipsOperation").nickname("fine");
        when(inspector.inspect(runtime.get("VipsBroken"), "broken")).thenReturn(Optional.empty());
        when(inspector.inspect(runtime.get("VipsFine"), "fine")).thenReturn(Optional.of(operation("fine")));

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("fine");
        assertThat(result.getSkippedTypes()).isEqualTo(1);
    }

    @Test
    void inconsistentOperationDoesNotHideTheRest() throws Exception {
        runtime.type("VipsTwice", "VipsOperation").nickname("twice");
        runtime.type("VipsFine", "VipsOperation").nickname("fine");
        when(inspector.inspect(runtime.get("VipsTwice"), "twice"))
                .thenThrow(new IllegalStateException("argument 'in' declared twice"));
        when(inspector.inspect(runtime.get("VipsFine"), "fine")).thenReturn(Optional.of(operation("fine")));

        DiscoveryResult result = stage().execute();

        assertThat(result.getOperations()).extracting(OperationDescriptor::getName).containsExactly("fine");
        assertThat(result.getSkippedTypes()).isEqualTo(1);
    }

    @Test
    void failsWhenBaseTypeIsMissing() {
        DiscoveryStage stage = new DiscoveryStage(new FakeRuntime(), inspector, TestConfigs.standard());

        assertThatThrownBy(stage::execute)
                .isInstanceOf(IntrospectionException.class)
                .hasMessageContaining("VipsOperation");
    }

    private DiscoveryStage stage() {
        return new DiscoveryStage(runtime, inspector, TestConfigs.standard());
    }

    private static OperationDescriptor operation(String name) {
        return new OperationDescriptor(name, "", "misc", List.of());
    }
}
