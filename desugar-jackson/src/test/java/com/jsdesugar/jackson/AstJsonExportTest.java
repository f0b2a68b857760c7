package com.jsdesugar.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsdesugar.AccessorDesugarer;
import com.jsdesugar.ast.*;
import com.jsdesugar.diagnostics.CollectingReporter;
import com.jsdesugar.json.AstJsonProvider;
import com.jsdesugar.json.AstJsonSerializer;
import com.jsdesugar.rewrite.RewriteOptions;
import com.jsdesugar.symbols.Declaration;
import com.jsdesugar.symbols.DeclarationSite;
import com.jsdesugar.symbols.Symbol;
import com.jsdesugar.symbols.SymbolOracle;
import com.jsdesugar.symbols.TypeSymbol;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonExportTest {

    private final ObjectMapper mapper = DesugarJackson.createObjectMapper();
    private final AstJsonSerializer serializer = new JacksonAstJsonProvider().getSerializer();

    private JsonNode tree(Node node) throws Exception {
        return mapper.readTree(serializer.serialize(node));
    }

    @Test
    void testNodesCarryTypeAndPosition() throws Exception {
        Span span = Span.of(0, 6, 1, 0, 1, 6);
        Program program = new Program(span, List.of(new ExpressionStatement(span, new Identifier(span, "answer"))), "module");

        JsonNode json = tree(program);

        assertEquals("Program", json.get("type").asText());
        assertEquals(0, json.get("start").asInt());
        assertEquals(6, json.get("end").asInt());
        assertEquals(1, json.get("loc").get("start").get("line").asInt());
        assertEquals(6, json.get("loc").get("end").get("column").asInt());
        assertEquals("module", json.get("sourceType").asText());
        assertFalse(json.has("span"));

        JsonNode identifier = json.get("body").get(0).get("expression");
        assertEquals("Identifier", identifier.get("type").asText());
        assertEquals("answer", identifier.get("name").asText());
    }

    @Test
    void testNumbersAreWrittenLikeJavaScript() throws Exception {
        assertEquals("5", tree(new Literal(5.0, "5")).get("value").toString());
        assertEquals("2.5", tree(new Literal(2.5, "2.5")).get("value").toString());
        assertTrue(tree(new Literal(Double.NaN, "NaN")).get("value").isNull());
        assertTrue(tree(new Literal(null, "null")).has("value"));
        assertEquals("\"hi\"", tree(new Literal("hi", "'hi'")).get("value").toString());
    }

    @Test
    void testStaticFlagAndRequiredNulls() throws Exception {
        FunctionExpression function = new FunctionExpression(null, List.of(),
            new BlockStatement(List.of(new ReturnStatement(null))), false, false);
        MethodDefinition method = new MethodDefinition(new Identifier("__getvalue"), function, "method", false, true);
        ClassDeclaration declaration = new ClassDeclaration(new Identifier("Box"), null, new ClassBody(List.of(method)));

        JsonNode json = tree(declaration);

        assertTrue(json.has("superClass"));
        assertTrue(json.get("superClass").isNull());
        JsonNode member = json.get("body").get("body").get(0);
        assertEquals("MethodDefinition", member.get("type").asText());
        assertTrue(member.get("static").asBoolean());
        assertFalse(member.has("isStatic"));
        assertTrue(member.get("value").has("id"));
        assertTrue(member.get("value").get("body").get("body").get(0).has("argument"));
    }

    @Test
    void testCastKeepsTypeScriptNodeName() throws Exception {
        JsonNode json = tree(new AsExpression(new Identifier("a"), "Box"));

        assertEquals("TSAsExpression", json.get("type").asText());
        assertEquals("Box", json.get("typeAnnotation").asText());
    }

    @Test
    void testEveryNodeClassIsMapped() {
        assertEquals(47, AstModule.concreteNodeClasses().size());
        assertTrue(AstModule.concreteNodeClasses().contains(Identifier.class));
        assertTrue(AstModule.concreteNodeClasses().contains(MemberExpression.class));
    }

    @Test
    void testRewrittenProgramExport() throws Exception {
        FunctionExpression body = new FunctionExpression(null, List.of(),
            new BlockStatement(List.of(new ReturnStatement(new Literal(1.0, "1")))), false, false);
        MethodDefinition getter = new MethodDefinition(new Identifier("value"), body, "get", false, false);
        ClassDeclaration box = new ClassDeclaration(new Identifier("Box"), null, new ClassBody(List.of(getter)));
        MemberExpression read = new MemberExpression(new Identifier("a"), new Identifier("value"), false);
        Program program = new Program(List.of(box, new ExpressionStatement(read)), "module");

        TypeSymbol type = TypeSymbol.of("Box");
        Symbol value = new Symbol("value", List.of(new Declaration(getter, DeclarationSite.CLASS, type)));
        SymbolOracle oracle = new SymbolOracle() {
            @Override
            public Optional<Symbol> symbolAt(Node node) {
                return node == getter || node == read ? Optional.of(value) : Optional.empty();
            }

            @Override
            public Optional<TypeSymbol> typeOf(Expression expression) {
                return Optional.empty();
            }

            @Override
            public Optional<Symbol> propertyOf(TypeSymbol owner, String name) {
                return Optional.empty();
            }

            @Override
            public List<TypeSymbol> baseTypesOf(TypeSymbol owner) {
                return List.of();
            }

            @Override
            public boolean isFromDependency(Declaration declaration) {
                return false;
            }
        };

        Program rewritten = new AccessorDesugarer(oracle, RewriteOptions.defaults(), new CollectingReporter())
            .desugar(program)
            .orElseThrow();
        JsonNode json = tree(rewritten);

        JsonNode method = json.get("body").get(0).get("body").get("body").get(0);
        assertEquals("method", method.get("kind").asText());
        assertEquals("__getvalue", method.get("key").get("name").asText());
        JsonNode call = json.get("body").get(1).get("expression");
        assertEquals("CallExpression", call.get("type").asText());
        assertEquals("__getvalue", call.get("callee").get("property").get("name").asText());
        assertEquals(0, call.get("arguments").size());
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testPrettyOutputParsesToSameTree() throws Exception {
        Program program = new Program(List.of(new EmptyStatement()), "script");

        assertEquals(mapper.readTree(serializer.serialize(program)),
            mapper.readTree(serializer.serializePretty(program)));
        assertTrue(serializer.serializePretty(program).contains("\n"));
    }
}
