package com.jsdesugar.symbols;

import com.jsdesugar.ast.ClassDeclaration;
import com.jsdesugar.ast.MemberExpression;
import com.jsdesugar.ast.MethodDefinition;
import com.jsdesugar.testing.TestOracle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jsdesugar.testing.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class AccessorClassifierTest {

    private static final TypeSymbol BOX = TypeSymbol.of("Box");

    private final MethodDefinition valueGetter = getter("value", ret(num(1)));
    private final MethodDefinition valueSetter = setter("value", "v");
    private final ClassDeclaration box = classDecl("Box", valueGetter, valueSetter);

    @Test
    void testClassAccessorsAreUserClass() {
        TestOracle oracle = new TestOracle().declareClass(BOX, box).variable("a", BOX);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertTrue(resolution.hasGetter());
        assertTrue(resolution.hasSetter());
        assertEquals(Provenance.USER_CLASS, resolution.getter().provenance());
        assertSame(valueGetter, resolution.getter().payload());
        assertSame(valueSetter, resolution.setter().payload());
        assertEquals(BOX, resolution.setter().owner());
        assertSame(resolution, resolution.rewritable());
    }

    @Test
    void testPlainPropertiesAndUnknownTargetsResolveToNone() {
        TestOracle oracle = new TestOracle().declareClass(BOX, box).variable("a", BOX);
        AccessorClassifier classifier = new AccessorClassifier(oracle);

        assertTrue(classifier.resolveAccessors(member("a", "other")).empty());
        assertTrue(classifier.resolveAccessors(member("unknown", "value")).empty());
        assertTrue(classifier.resolveAccessors(computed(id("a"), str("value"))).empty());
    }

    @Test
    void testFallsBackToTypeOfTarget() {
        TestOracle oracle = new TestOracle().declareClass(BOX, box).variable("a", BOX)
            .membersResolveDirectly(false);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertTrue(resolution.hasGetter());
        assertEquals(Provenance.USER_CLASS, resolution.setter().provenance());
    }

    @Test
    void testClassDeclarationsFoundThroughTypeWinOverDirectContract() {
        TypeSymbol shape = TypeSymbol.of("Shape");
        MethodDefinition contract = getter("value");
        TestOracle oracle = new TestOracle().declareClass(BOX, box).variable("a", BOX);
        MemberExpression access = member("a", "value");
        oracle.bind(access, new Symbol("value", List.of(new Declaration(contract, DeclarationSite.INTERFACE, shape))));

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(access);

        assertEquals(Provenance.USER_CLASS, resolution.getter().provenance());
        assertSame(valueGetter, resolution.getter().payload());
    }

    @Test
    void testInterfaceAndAmbientAccessorsAreNotRewritable() {
        TypeSymbol shape = TypeSymbol.of("Shape");
        TypeSymbol ambient = TypeSymbol.of("Ambient");
        TestOracle oracle = new TestOracle()
            .declareContract(shape, DeclarationSite.INTERFACE, getter("area"))
            .declareContract(ambient, DeclarationSite.AMBIENT, setter("mode", "v"))
            .variable("s", shape)
            .variable("m", ambient);
        AccessorClassifier classifier = new AccessorClassifier(oracle);

        AccessorResolution area = classifier.resolveAccessors(member("s", "area"));
        AccessorResolution mode = classifier.resolveAccessors(member("m", "mode"));

        assertEquals(Provenance.INTERFACE_OR_AMBIENT, area.getter().provenance());
        assertEquals(Provenance.INTERFACE_OR_AMBIENT, mode.setter().provenance());
        assertTrue(area.rewritable().empty());
        assertTrue(mode.rewritable().empty());
    }

    @Test
    void testDependencyAccessorsAreExternal() {
        TestOracle oracle = new TestOracle().declareClass(BOX, box).fromDependency(BOX).variable("a", BOX);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertEquals(Provenance.EXTERNAL_DEPENDENCY, resolution.getter().provenance());
        assertTrue(resolution.rewritable().empty());
    }

    @Test
    void testIndirectHostIntrinsicBaseIsExternal() {
        TypeSymbol root = TypeSymbol.intrinsic("HTMLElement");
        TypeSymbol middle = TypeSymbol.of("BaseElement");
        TestOracle oracle = new TestOracle().declareClass(BOX, box)
            .extend(BOX, middle)
            .extend(middle, root)
            .variable("a", BOX);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertEquals(Provenance.EXTERNAL_DEPENDENCY, resolution.getter().provenance());
        assertEquals(Provenance.EXTERNAL_DEPENDENCY, resolution.setter().provenance());
    }

    @Test
    void testCyclicBaseTypesTerminate() {
        TypeSymbol other = TypeSymbol.of("Other");
        TestOracle oracle = new TestOracle().declareClass(BOX, box)
            .extend(BOX, other)
            .extend(other, BOX)
            .variable("a", BOX);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertEquals(Provenance.USER_CLASS, resolution.getter().provenance());
    }

    @Test
    void testInheritedAccessorsResolveThroughBaseClass() {
        TypeSymbol derived = TypeSymbol.of("Derived");
        TestOracle oracle = new TestOracle().declareClass(BOX, box)
            .declareClass(derived, classDecl("Derived", "Box"))
            .extend(derived, BOX)
            .variable("d", derived);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("d", "value"));

        assertEquals(BOX, resolution.getter().owner());
        assertEquals(Provenance.USER_CLASS, resolution.getter().provenance());
    }

    @Test
    void testNativeAccessorOwner() {
        TypeSymbol custom = TypeSymbol.of("Custom");
        MethodDefinition label = getter("label");
        TestOracle oracle = new TestOracle()
            .declareClass(BOX, box)
            .declareClass(custom, classDecl("Custom", "HTMLElement", label))
            .extend(custom, TypeSymbol.intrinsic("HTMLElement"));
        AccessorClassifier classifier = new AccessorClassifier(oracle);

        assertTrue(classifier.hasNativeAccessorOwner(label));
        assertFalse(classifier.hasNativeAccessorOwner(valueGetter));
        assertFalse(classifier.hasNativeAccessorOwner(getter("unknown")));
    }

    @Test
    void testFirstDeclarationOfEachKindWins() {
        MethodDefinition second = getter("value", ret(num(2)));
        TestOracle oracle = new TestOracle().declareClass(BOX, classDecl("Box", valueGetter, second)).variable("a", BOX);

        AccessorResolution resolution = new AccessorClassifier(oracle).resolveAccessors(member("a", "value"));

        assertSame(valueGetter, resolution.getter().payload());
        assertFalse(resolution.hasSetter());
    }
}
