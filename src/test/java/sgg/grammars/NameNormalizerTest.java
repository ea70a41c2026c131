package sgg.grammars;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer("Syntax");

    @Test
    public void testSuffixIsStripped() {
        assertEquals("break_statement", normalizer.normalize("BreakStatementSyntax"));
        assertEquals("statement", normalizer.normalize("StatementSyntax"));
        assertEquals("compilation_unit", normalizer.normalize("CompilationUnitSyntax"));
    }

    @Test
    public void testSuffixOnlyAtTheEnd() {
        assertEquals("syntax_trivia", normalizer.normalize("SyntaxTrivia"));
        assertEquals("identifier_token", normalizer.normalize("IdentifierToken"));
        assertEquals("modifier", normalizer.normalize("Modifier"));
    }

    @Test
    public void testUpperCaseRuns() {
        assertEquals("xml_c_data_section", normalizer.normalize("XmlCDataSectionSyntax"));
        assertEquals("io_exception", normalizer.normalize("IOException"));
    }

    @Test
    public void testDigits() {
        assertEquals("utf_8_string_literal_token", normalizer.normalize("Utf8StringLiteralToken"));
    }

    @Test
    public void testWithoutSuffix() {
        var plain = new NameNormalizer("");
        assertEquals("break_statement_syntax", plain.normalize("BreakStatementSyntax"));
        assertEquals(plain.normalize("BreakStatementSyntax"), new NameNormalizer(null).normalize("BreakStatementSyntax"));
    }

    @Test
    public void testNormalizeAll() {
        var names = normalizer.normalizeAll(List.of("BreakStatementSyntax", "Token", "BreakStatementSyntax"));
        assertEquals(2, names.size());
        assertEquals("break_statement", names.get("BreakStatementSyntax"));
        assertEquals("Token", names.inverse().get("token"));
    }

    @Test
    public void testCollision() {
        var e = assertThrows(GrammarGenerationException.class,
                () -> normalizer.normalizeAll(List.of("FooBarSyntax", "FooBar")));
        assertEquals(GrammarGenerationException.Reason.NAME_COLLISION, e.getReason());
        assertTrue(e.getMessage().contains("foo_bar"), e.getMessage());
        assertTrue(e.getMessage().contains("FooBarSyntax"), e.getMessage());
    }
}
