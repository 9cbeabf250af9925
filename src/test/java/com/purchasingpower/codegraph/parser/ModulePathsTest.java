package com.purchasingpower.codegraph.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Module path derivation")
class ModulePathsTest {

    @Test
    @DisplayName("Should derive modules and packages from Python paths")
    void shouldDerivePythonModules() {
        assertThat(ModulePaths.moduleOf("pkg/base.py")).isEqualTo("pkg.base");
        assertThat(ModulePaths.packageOf("pkg/base.py")).isEqualTo("pkg");
        assertThat(ModulePaths.moduleOf("pkg/__init__.py")).isEqualTo("pkg");
        assertThat(ModulePaths.packageOf("pkg/__init__.py")).isEqualTo("pkg");
        assertThat(ModulePaths.packageOf("main.py")).isEmpty();
    }

    @Test
    @DisplayName("Should strip Java source roots")
    void shouldStripJavaSourceRoots() {
        assertThat(ModulePaths.moduleOf("svc/src/main/java/com/acme/Foo.java")).isEqualTo("com.acme.Foo");
        assertThat(ModulePaths.packageOf("src/test/java/com/acme/FooTest.java")).isEqualTo("com.acme");
    }

    @Test
    @DisplayName("Should normalize separators and leading markers")
    void shouldNormalize() {
        assertThat(ModulePaths.normalize(".\\pkg\\a.py")).isEqualTo("pkg/a.py");
        assertThat(ModulePaths.normalize("/pkg/a.py")).isEqualTo("pkg/a.py");
    }

    @Test
    @DisplayName("Should list every package prefix outermost first")
    void shouldListPrefixes() {
        assertThat(ModulePaths.packagePrefixes("a.b.c")).containsExactly("a", "a.b", "a.b.c");
        assertThat(ModulePaths.packagePrefixes("")).isEmpty();
        assertThat(ModulePaths.parentPackage("a.b.c")).isEqualTo("a.b");
        assertThat(ModulePaths.parentPackage("a")).isNull();
    }
}
