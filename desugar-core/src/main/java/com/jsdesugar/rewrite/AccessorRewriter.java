package com.jsdesugar.rewrite;

import com.jsdesugar.ast.*;
import com.jsdesugar.diagnostics.Diagnostic;
import com.jsdesugar.diagnostics.DiagnosticKind;
import com.jsdesugar.diagnostics.DiagnosticReporter;
import com.jsdesugar.diagnostics.NodeText;
import com.jsdesugar.symbols.AccessorClassifier;
import com.jsdesugar.symbols.AccessorKind;
import com.jsdesugar.symbols.AccessorResolution;
import com.jsdesugar.tree.ParentIndex;
import com.jsdesugar.tree.TreeQueries;
import com.jsdesugar.tree.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rewrites accessor syntax into calls of synthesized methods, in one depth-first pass:
 *
 * <pre>
 * get value() {...}        =&gt;  __getvalue() {...}
 * a.value                  =&gt;  a.__getvalue()
 * a.value = x              =&gt;  a.__setvalue(x)
 * a.value += x             =&gt;  a.__setvalue(a.__getvalue() + x)
 * a.value++                =&gt;  a.__setvalue(a.__getvalue() + 1)
 * </pre>
 *
 * <p>Each rule transforms the children it keeps exactly once, either before or after
 * building its replacement. Replacements are never visited again.</p>
 *
 * <p>An instance serves a single tree; use {@link #rewrite}.</p>
 */
public final class AccessorRewriter extends TreeTransformer {

    private static final Logger log = LoggerFactory.getLogger(AccessorRewriter.class);

    // Compound assignment operator -> the operator that computes the new value
    private static final Map<String, String> COMPOUND_OPERATORS = Map.ofEntries(
        Map.entry("+=", "+"),
        Map.entry("-=", "-"),
        Map.entry("*=", "*"),
        Map.entry("/=", "/"),
        Map.entry("%=", "%"),
        Map.entry("**=", "**"),
        Map.entry("<<=", "<<"),
        Map.entry(">>=", ">>"),
        Map.entry(">>>=", ">>>"),
        Map.entry("&=", "&"),
        Map.entry("|=", "|"),
        Map.entry("^=", "^"),
        Map.entry("&&=", "&&"),
        Map.entry("||=", "||"),
        Map.entry("??=", "??")
    );

    private final RewriteContext context;
    private final AccessorClassifier classifier;
    private final DiagnosticReporter reporter;
    private final ParentIndex parents;
    private final Map<MemberExpression, AccessorResolution> resolutions = new IdentityHashMap<>();

    private AccessorRewriter(RewriteContext context, AccessorClassifier classifier, DiagnosticReporter reporter,
                             ParentIndex parents) {
        this.context = context;
        this.classifier = classifier;
        this.reporter = reporter;
        this.parents = parents;
    }

    /**
     * Desugars every accessor in the tree below {@code root}.
     *
     * @return the rewritten tree; the input is left untouched
     * @throws MissingGetterException       if a read-modify-write targets a setter-only member
     * @throws DuplicateEvaluationException if a read-modify-write target contains a {@code new} expression
     */
    @SuppressWarnings("unchecked")
    public static <T extends Node> T rewrite(T root, RewriteContext context, AccessorClassifier classifier,
                                             DiagnosticReporter reporter) {
        AccessorRewriter rewriter = new AccessorRewriter(context, classifier, reporter, ParentIndex.of(root));
        return (T) root.accept(rewriter);
    }

    // ==================== Accessor declarations ====================

    @Override
    public Node visitMethodDefinition(MethodDefinition node) {
        String name = node.keyName();
        if (!node.accessor() || name == null || classifier.hasNativeAccessorOwner(node)) {
            return super.visitMethodDefinition(node);
        }
        AccessorKind kind = MethodDefinition.KIND_GET.equals(node.kind()) ? AccessorKind.GETTER : AccessorKind.SETTER;
        String methodName = context.options().methodName(kind, name);
        log.debug("Renaming {} accessor '{}' to '{}'", node.kind(), name, methodName);
        return context.factory().method(node, methodName, transform(node.value()));
    }

    // ==================== Member access ====================

    @Override
    public Node visitMemberExpression(MemberExpression node) {
        AccessorResolution resolution = resolve(node);
        if (resolution.empty()) {
            return super.visitMemberExpression(node);
        }

        // Setter calls are built by the enclosing write; a write target left here stays as written
        if (enclosingWrite(node).isPresent()) {
            return super.visitMemberExpression(node);
        }

        if (isUnrewritableWriteTarget(node)) {
            reporter.report(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET,
                "'" + NodeText.of(node) + "' is backed by accessors but assigned by destructuring; left unchanged",
                node.span());
            return super.visitMemberExpression(node);
        }

        String getter = context.options().methodName(AccessorKind.GETTER, node.propertyName());
        return context.factory().getterCall(node, transform(node.object()), getter);
    }

    private MemberExpression setterReference(MemberExpression node) {
        String setter = context.options().methodName(AccessorKind.SETTER, node.propertyName());
        return context.factory().methodReference(node, transform(node.object()), setter);
    }

    // ==================== Writes ====================

    @Override
    public Node visitAssignmentExpression(AssignmentExpression node) {
        MemberExpression target = memberTarget(node.left());
        if (target == null || !resolve(target).hasSetter()) {
            return super.visitAssignmentExpression(node);
        }

        if ("=".equals(node.operator())) {
            MemberExpression setter = setterReference(target);
            return context.factory().call(node.span(), setter, List.of(transform(node.right())));
        }

        String operator = COMPOUND_OPERATORS.get(node.operator());
        if (operator == null) {
            return super.visitAssignmentExpression(node);
        }
        return readModifyWrite(node, target, operator, () -> transform(node.right()));
    }

    @Override
    public Node visitUpdateExpression(UpdateExpression node) {
        MemberExpression target = memberTarget(node.argument());
        if (target == null || !resolve(target).hasSetter()) {
            return super.visitUpdateExpression(node);
        }
        String operator = "++".equals(node.operator()) ? "+" : "-";
        return readModifyWrite(node, target, operator, () -> context.factory().number(1));
    }

    /**
     * {@code target.set(target.get() operator operand)}, with the target object
     * evaluated into a single shared node.
     */
    private Expression readModifyWrite(Expression operation, MemberExpression target, String operator,
                                       Supplier<Expression> operand) {
        AccessorResolution resolution = resolve(target);
        if (!resolution.hasGetter()) {
            throw new MissingGetterException(new Diagnostic(
                DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE,
                "Cannot desugar '" + NodeText.of(operation) + "' in '" + statementText(operation) + "': '"
                    + target.propertyName() + "' has a setter but no getter, and reading the current value needs one",
                operation.span()));
        }
        if (TreeQueries.subtreeContains(target.object(), NewExpression.class::isInstance)) {
            throw new DuplicateEvaluationException(new Diagnostic(
                DiagnosticKind.UNSUPPORTED_DUPLICATE_EVALUATION_TARGET,
                "Cannot desugar '" + NodeText.of(operation) + "' in '" + statementText(operation) + "': '"
                    + NodeText.of(target.object()) + "' would be evaluated twice and constructs an object;"
                    + " assign it to a temporary variable first",
                operation.span()));
        }

        NodeFactory factory = context.factory();
        Expression object = transform(target.object());
        String getter = context.options().methodName(AccessorKind.GETTER, target.propertyName());
        String setter = context.options().methodName(AccessorKind.SETTER, target.propertyName());

        Expression current = factory.getterCall(target, object, getter);
        Expression updated = factory.combine(operation.span(), operator, current, operand.get());
        return factory.call(operation.span(), factory.methodReference(target, object, setter), List.of(updated));
    }

    // ==================== Helpers ====================

    private AccessorResolution resolve(MemberExpression node) {
        return resolutions.computeIfAbsent(node, member -> classifier.resolveAccessors(member).rewritable());
    }

    private static MemberExpression memberTarget(Node target) {
        Node unwrapped = TreeQueries.unwrap(target);
        return unwrapped instanceof MemberExpression member ? member : null;
    }

    /**
     * The assignment or update directly around the node (looking through parentheses
     * and casts) that writes to it. Binary expressions never count, whatever their operator.
     */
    private Optional<Node> enclosingWrite(MemberExpression node) {
        Optional<Node> write = TreeQueries.findAncestorMatching(parents, node,
            candidate -> candidate instanceof AssignmentExpression || candidate instanceof UpdateExpression);
        return write.filter(candidate -> {
            Node target = candidate instanceof AssignmentExpression assignment
                ? assignment.left()
                : ((UpdateExpression) candidate).argument();
            return target == node || TreeQueries.isDescendantOf(target, node);
        });
    }

    /**
     * Write positions that cannot become a setter call: destructuring elements and
     * the left side of a for-of loop.
     */
    private boolean isUnrewritableWriteTarget(MemberExpression node) {
        Optional<Node> parent = parents.parentOf(node);
        if (parent.isEmpty()) {
            return false;
        }
        Node candidate = parent.get();
        if (candidate instanceof ArrayPattern || candidate instanceof RestElement) {
            return true;
        }
        if (candidate instanceof AssignmentPattern pattern) {
            return pattern.left() == node;
        }
        if (candidate instanceof ForOfStatement loop) {
            return loop.left() == node;
        }
        if (candidate instanceof Property property && property.value() == node) {
            return parents.parentOf(property).filter(ObjectPattern.class::isInstance).isPresent();
        }
        return false;
    }

    private String statementText(Node node) {
        return TreeQueries.findEnclosing(parents, node, Statement.class::isInstance)
            .map(NodeText::of)
            .orElseGet(() -> NodeText.of(node));
    }
}
