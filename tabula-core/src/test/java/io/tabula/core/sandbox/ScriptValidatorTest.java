package io.tabula.core.sandbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ScriptValidatorTest {
    private final ScriptValidator validator = new ScriptValidator();

    @Test
    void shouldAllowAnalysisImports() throws Exception {
        String code = "import pandas as pd\nfrom numpy import mean\nresult = df['price'].mean()";

        assertThat(validator.validate(code)).isEqualTo(code);
    }

    @Test
    void shouldRejectUnknownImport() {
        assertThatThrownBy(() -> validator.validate("import requests\nrequests.get('http://x')"))
            .isInstanceOf(QueryRejectedException.class)
            .hasMessageContaining("'requests'");
    }

    @Test
    void shouldRejectFileAndProcessAccess() {
        assertThatThrownBy(() -> validator.validate("open('/etc/passwd').read()"))
            .hasMessageContaining("file access");
        assertThatThrownBy(() -> validator.validate("import subprocess"))
            .hasMessageContaining("process access");
        assertThatThrownBy(() -> validator.validate("eval('1 + 1')"))
            .hasMessageContaining("eval()");
    }
}
