package io.meld.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.meld.core.error.DocumentParseException;
import io.meld.core.model.ImportSpecifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ImportListParser")
class ImportListParserTest {

    @Test
    @DisplayName("names, aliases in both spellings and the wildcard")
    void entries() {
        assertThat(ImportListParser.parse("greeting, config as cfg, docs:d, *"))
                .containsExactly(
                        new ImportSpecifier("greeting", null),
                        new ImportSpecifier("config", "cfg"),
                        new ImportSpecifier("docs", "d"),
                        ImportSpecifier.WILDCARD);
    }

    @Test
    @DisplayName("alias is the target name")
    void targetName() {
        assertThat(ImportListParser.parse("config as cfg").get(0).targetName()).isEqualTo("cfg");
        assertThat(ImportListParser.parse("config").get(0).targetName()).isEqualTo("config");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "a,", "a b", "a as", "1abc", "a as b as c"})
    @DisplayName("malformed lists are rejected")
    void malformed(String list) {
        assertThatThrownBy(() -> ImportListParser.parse(list)).isInstanceOf(DocumentParseException.class);
    }
}
