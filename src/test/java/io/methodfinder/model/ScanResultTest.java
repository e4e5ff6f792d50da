package io.methodfinder.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanResultTest {

    @Test
    void constructor_sortsCallsByClassMethodLine() {
        List<FoundCall> calls = new ArrayList<>(List.of(
                new FoundCall("b.B", "m", 3),
                new FoundCall("a.A", "z", 1),
                new FoundCall("a.A", "m", 9),
                new FoundCall("a.A", "m", null),
                new FoundCall("a.A", "m", 2)));

        ScanResult result = new ScanResult(calls, List.of(), 2);

        assertThat(result.calls()).containsExactly(
                new FoundCall("a.A", "m", null),
                new FoundCall("a.A", "m", 2),
                new FoundCall("a.A", "m", 9),
                new FoundCall("a.A", "z", 1),
                new FoundCall("b.B", "m", 3));
        assertThat(result.hasCalls()).isTrue();
        assertThat(result.filesScanned()).isEqualTo(2);
    }

    @Test
    void constructor_copiesAndSortsWarnings() {
        List<ScanWarning> warnings = new ArrayList<>(List.of(
                new ScanWarning(Path.of("b/B.class"), "x"),
                new ScanWarning(Path.of("a/A.class"), "y"),
                new ScanWarning(Path.of("a/A.class"), "b")));

        ScanResult result = new ScanResult(List.of(), warnings, 3);
        warnings.clear();

        assertThat(result.warnings()).extracting(ScanWarning::message).containsExactly("b", "y", "x");
        assertThat(result.hasWarnings()).isTrue();
        assertThat(result.hasCalls()).isFalse();
        assertThatThrownBy(() -> result.calls().add(new FoundCall("a", "b", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void targetMethod_matchesByClassAndNameOnly() {
        TargetMethod target = new TargetMethod("java.lang.String", "valueOf");

        assertThat(target.matches(new MethodRef("java.lang.String", "valueOf", "(I)Ljava/lang/String;"))).isTrue();
        assertThat(target.matches(MethodRef.fromInternalName("java/lang/String", "valueOf", "(Z)Ljava/lang/String;")))
                .isTrue();
        assertThat(target.matches(new MethodRef("java.lang.String", "valueOfx", "()V"))).isFalse();
        assertThat(target.matches(new MethodRef("java.lang.StringBuilder", "valueOf", "()V"))).isFalse();
        assertThat(target.key()).isEqualTo("java.lang.String#valueOf");
    }

    @Test
    void foundCall_formatted() {
        assertThat(new FoundCall("com.example.C", "run", 8).formatted()).isEqualTo("com.example.C#run (L8)");
        assertThat(new FoundCall("com.example.C", "run", null).formatted()).isEqualTo("com.example.C#run");
    }

    @Test
    void invokeType_fromOpcode() {
        assertThat(InvokeType.fromOpcode(0xB6)).isEqualTo(InvokeType.VIRTUAL);
        assertThat(InvokeType.fromOpcode(0xB9)).isEqualTo(InvokeType.INTERFACE);
        assertThat(InvokeType.fromOpcode(0xBA)).isNull();
        assertThat(InvokeType.SPECIAL.mnemonic()).isEqualTo("invokespecial");
    }
}
