package sgg.grammars;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.io.Resources;

import sgg.schema.SchemaLoader;
import sgg.schema.SyntaxSchema;
import sgg.schema.TreeType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Generates the grammar for a trimmed down C# schema with the built-in
 * profile.
 */
public class CSharpGrammarTest {

    private static SyntaxSchema schema;
    private static String grammar;
    private static Map<String, List<String>> rules;

    @BeforeAll
    public static void generate() throws IOException {
        String source = Resources.toString(Resources.getResource("sgg/csharp-sample.syntax"), UTF_8);
        schema = SchemaLoader.parse(source, "csharp-sample.syntax");
        grammar = new GrammarGenerator(schema, GrammarConfiguration.csharp()).generate();
        rules = GrammarText.parse(grammar);
    }

    @Test
    public void testHeader() {
        assertTrue(grammar.startsWith("// <auto-generated />\ngrammar csharp;\n\ncompilation_unit\n  : "), grammar);
        assertFalse(grammar.endsWith("\n"));
    }

    @Test
    public void testCompilationUnit() {
        assertEquals(List.of("extern_alias_directive* using_directive* attribute_list* member_declaration* EOF"),
                rules.get("compilation_unit"));
    }

    @Test
    public void testMajorSectionOrder() {
        List<String> names = Lists.newArrayList(rules.keySet());
        int previous = -1;
        for (String section : List.of("compilation_unit", "member_declaration", "statement", "expression", "type",
                "xml_node", "structured_trivia")) {
            int index = names.indexOf(section);
            assertTrue(index > previous, section + " out of order in " + names);
            previous = index;
        }
    }

    @Test
    public void testAlternatives() {
        assertEquals(List.of("block", "break_statement", "expression_statement", "if_statement", "return_statement"),
                rules.get("statement"));
        assertEquals(List.of("array_type", "name", "omitted_type_argument", "predefined_type"),
                rules.get("type"));
        assertEquals(List.of("base_namespace_declaration", "method_declaration", "type_declaration"),
                rules.get("member_declaration"));
    }

    @Test
    public void testFlattenedTokens() {
        assertEquals(List.of("'global'", "identifier_token"), rules.get("identifier_name"));
        assertEquals(List.of("'default'", "'false'", "'null'", "'true'",
                "character_literal_token", "numeric_literal_token", "string_literal_token"),
                rules.get("literal_expression"));
        assertEquals(List.of("/* epsilon */"), rules.get("omitted_array_size_expression"));
        assertEquals(List.of("identifier_token"), rules.get("xml_name"));
    }

    @Test
    public void testModifiers() {
        assertEquals(List.of("'abstract'", "'async'", "'const'", "'extern'", "'file'", "'fixed'", "'internal'",
                "'new'", "'override'", "'partial'", "'private'", "'protected'", "'public'", "'readonly'", "'ref'",
                "'required'", "'scoped'", "'sealed'", "'static'", "'unsafe'", "'virtual'", "'volatile'"),
                rules.get("modifier"));
        assertEquals(List.of("attribute_list* modifier* type? ('__arglist' | identifier_token) equals_value_clause?"),
                rules.get("parameter"));
    }

    @Test
    public void testChoiceInMethodBody() {
        assertEquals(List.of("attribute_list* modifier* type identifier_token parameter_list"
                + " (block | (arrow_expression_clause ';') | ';')"),
                rules.get("method_declaration"));
    }

    @Test
    public void testSeparatedLists() {
        assertEquals(List.of("'[' attribute (',' attribute)* ']'"), rules.get("attribute_list"));
        assertEquals(List.of("'(' (argument (',' argument)*)? ')'"), rules.get("argument_list"));
    }

    @Test
    public void testDirectives() {
        assertEquals(List.of("'#' 'pragma' 'warning' ('disable' | 'restore') (expression (',' expression)*)?"),
                rules.get("pragma_warning_directive_trivia"));
        assertEquals(List.of("'#' 'endif'"), rules.get("end_if_directive_trivia"));
        assertEquals(List.of("xml_node*"), rules.get("documentation_comment_trivia"));
    }

    @Test
    public void testQuotedSpellings() {
        assertEquals(List.of("xml_name '=' ('\"' | '\\'') xml_text_literal_token* ('\"' | '\\'')"),
                rules.get("xml_text_attribute"));
        assertEquals(List.of("'<![CDATA[' xml_text_literal_token* ']]>'"), rules.get("xml_c_data_section"));
        assertEquals(List.of("('$\"' | '$@\"') interpolated_string_content* '\"'"),
                rules.get("interpolated_string_expression"));
    }

    @Test
    public void testLexicalPlaceholders() {
        for (String lexical : List.of("token", "identifier_token", "character_literal_token", "string_literal_token",
                "numeric_literal_token", "interpolated_string_text_token", "xml_text_literal_token")) {
            assertEquals(List.of(GrammarGenerator.LEXICAL_PLACEHOLDER), rules.get(lexical), lexical);
        }
    }

    @Test
    public void testProductionsAreSorted() {
        for (Map.Entry<String, List<String>> e : rules.entrySet()) {
            assertTrue(Ordering.<String>natural().isStrictlyOrdered(e.getValue()), e.getKey() + ": " + e.getValue());
        }
    }

    @Test
    public void testNoDanglingReferences() {
        for (Map.Entry<String, List<String>> e : rules.entrySet()) {
            for (String production : e.getValue()) {
                for (String ref : GrammarText.references(production)) {
                    assertTrue(rules.containsKey(ref), e.getKey() + " references missing rule " + ref);
                }
            }
        }
    }

    @Test
    public void testEveryDerivedTypeIsAnAlternative() {
        NameNormalizer normalizer = new NameNormalizer("Syntax");
        for (TreeType t : schema.getTypes()) {
            if (t.hasBase() && !t.getBase().equals(schema.getRootType())) {
                List<String> alternatives = rules.get(normalizer.normalize(t.getBase()));
                assertNotNull(alternatives, t.getBase());
                assertTrue(alternatives.contains(normalizer.normalize(t.getName())), t.getName());
            }
        }
    }

    @Test
    public void testUnusedTypesAreNotEmitted() {
        assertFalse(rules.containsKey("syntax_token"));
        assertFalse(rules.containsKey("c_sharp_syntax_node"));
    }
}
