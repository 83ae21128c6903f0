package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.aggregate.ValueSignature;
import com.usageprofile.counter.api.ApiDescription;
import com.usageprofile.counter.api.ApiElement;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static com.usageprofile.counter.static_analysis.PythonNodeTypes.*;

/**
 * Walks a parsed file in program order and emits one {@link CallSite} per call expression.
 *
 * Callees are composed through the file's {@link AliasTable}: the root name of an
 * attribute chain is looked up, the attribute path appended, and the result canonicalized
 * through the API description's re-exports. Function and lambda bodies are analyzed where
 * they are defined.
 */
public class CallResolver {

    private final ApiDescription api;
    private final boolean inferInstances;

    public CallResolver(ApiDescription api, boolean inferInstances) {
        this.api = api;
        this.inferInstances = inferInstances;
    }

    public List<CallSite> resolve(ParsedSource source) {
        Walker walker = new Walker(source);
        walker.visit(source.root());
        return walker.sites;
    }

    /** Callee resolution plus the class being instantiated, if the callee is a class. */
    private record Callee(CallTarget target, String constructedClass) {
        static Callee unresolved(CallTarget.Reason reason) {
            return new Callee(new CallTarget.Unresolved(reason), null);
        }
    }

    private final class Walker {

        private final ParsedSource src;
        private final AliasTable table;
        private final AliasResolver aliases;
        private final List<CallSite> sites = new ArrayList<>();

        Walker(ParsedSource src) {
            this.src = src;
            this.table = new AliasTable(api);
            this.aliases = new AliasResolver(table, src);
        }

        void visit(TSNode node) {
            if (node == null || node.isNull()) return;
            switch (node.getType()) {
                case ERROR:
                case FUTURE_IMPORT:
                    return;
                case IMPORT:
                    aliases.applyImport(node);
                    return;
                case IMPORT_FROM:
                    aliases.applyImportFrom(node);
                    return;
                case CALL:
                    visitCall(node);
                    return;
                case ASSIGNMENT:
                    assign(node);
                    return;
                case AUGMENTED_ASSIGNMENT:
                    visit(node.getChildByFieldName("right"));
                    bindTarget(node.getChildByFieldName("left"), Binding.SHADOWED);
                    return;
                case NAMED_EXPRESSION:
                    visit(node.getChildByFieldName("value"));
                    bindTarget(node.getChildByFieldName("name"), Binding.SHADOWED);
                    return;
                case FUNCTION_DEFINITION:
                    visitFunction(node);
                    return;
                case CLASS_DEFINITION:
                    visitClass(node);
                    return;
                case LAMBDA:
                    visitLambda(node);
                    return;
                case LIST_COMPREHENSION:
                case SET_COMPREHENSION:
                case DICTIONARY_COMPREHENSION:
                case GENERATOR_EXPRESSION:
                    visitComprehension(node);
                    return;
                case IF:
                    visitIf(node);
                    return;
                case FOR:
                    visitFor(node);
                    return;
                case WHILE:
                    visitWhile(node);
                    return;
                case TRY:
                    visitTry(node);
                    return;
                case WITH:
                    visitWith(node);
                    return;
                case MATCH:
                    visitMatch(node);
                    return;
                case GLOBAL:
                    forEachIdentifier(node, table::declareGlobal);
                    return;
                case NONLOCAL:
                    forEachIdentifier(node, table::declareNonlocal);
                    return;
                case DELETE:
                    visitDelete(node);
                    return;
                default:
                    visitChildren(node);
            }
        }

        private void visitChildren(TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                visit(node.getNamedChild(i));
            }
        }

        // ---- calls ----

        private void visitCall(TSNode call) {
            TSNode function = call.getChildByFieldName("function");
            TSNode arguments = call.getChildByFieldName("arguments");
            Callee callee = function.isNull()
                    ? Callee.unresolved(CallTarget.Reason.DYNAMIC_CALLEE)
                    : resolveCallee(function);
            sites.add(new CallSite(src.file().relativePath(), ParsedSource.line(call), ParsedSource.column(call),
                    callee.target(), collectArguments(arguments)));

            // Nested calls in the callee (a().b()) and in the arguments are call sites of their own
            visit(function);
            visit(arguments);
        }

        private List<CallArgument> collectArguments(TSNode arguments) {
            List<CallArgument> result = new ArrayList<>();
            if (arguments.isNull()) return result;
            if (GENERATOR_EXPRESSION.equals(arguments.getType())) {
                result.add(CallArgument.positional(ValueSignature.kind("generator")));
                return result;
            }
            for (int i = 0; i < arguments.getNamedChildCount(); i++) {
                TSNode arg = arguments.getNamedChild(i);
                switch (arg.getType()) {
                    case "comment":
                        break;
                    case KEYWORD_ARGUMENT: {
                        TSNode name = arg.getChildByFieldName("name");
                        TSNode value = arg.getChildByFieldName("value");
                        if (name.isNull() || value.isNull()) break;
                        result.add(CallArgument.keyword(src.text(name), ValueClassifier.classify(value, src)));
                        break;
                    }
                    case LIST_SPLAT:
                        result.add(CallArgument.listSplat());
                        break;
                    case DICTIONARY_SPLAT:
                        result.add(CallArgument.dictSplat());
                        break;
                    default:
                        result.add(CallArgument.positional(ValueClassifier.classify(arg, src)));
                }
            }
            return result;
        }

        private Callee resolveCallee(TSNode function) {
            List<String> path = new ArrayList<>();
            TSNode node = function;
            while (true) {
                if (ATTRIBUTE.equals(node.getType())) {
                    TSNode attr = node.getChildByFieldName("attribute");
                    TSNode object = node.getChildByFieldName("object");
                    if (attr.isNull() || object.isNull()) return Callee.unresolved(CallTarget.Reason.DYNAMIC_CALLEE);
                    path.add(0, src.text(attr));
                    node = object;
                } else if (PARENTHESIZED.equals(node.getType()) && node.getNamedChildCount() == 1) {
                    node = node.getNamedChild(0);
                } else {
                    break;
                }
            }
            if (!IDENTIFIER.equals(node.getType())) {
                return Callee.unresolved(CallTarget.Reason.DYNAMIC_CALLEE);
            }

            AliasTable.Lookup lookup = table.lookup(src.text(node));
            if (!lookup.isBound()) {
                return Callee.unresolved(lookup.ambiguousWildcard()
                        ? CallTarget.Reason.AMBIGUOUS_WILDCARD
                        : CallTarget.Reason.UNBOUND_NAME);
            }
            Binding binding = lookup.binding();
            if (binding instanceof Binding.Instance instance && path.isEmpty()) {
                return resolveQualified(instance.className() + ".__call__");
            }
            if (!path.isEmpty()) {
                binding = binding.member(String.join(".", path));
            }
            if (binding instanceof Binding.Origin origin) {
                return resolveQualified(origin.qualifiedName());
            }
            if (binding instanceof Binding.Ambiguous) {
                return Callee.unresolved(CallTarget.Reason.AMBIGUOUS_BINDING);
            }
            return Callee.unresolved(CallTarget.Reason.SHADOWED_NAME);
        }

        private Callee resolveQualified(String qualifiedName) {
            String canonical = api.canonicalize(qualifiedName);
            Optional<ApiElement> element = api.element(canonical);
            if (element.isEmpty()) {
                return Callee.unresolved(CallTarget.Reason.NOT_IN_API);
            }
            if (element.get().isCallable()) {
                return new Callee(new CallTarget.Resolved(canonical), null);
            }
            if (element.get().kind() == ApiElement.Kind.CLASS) {
                String init = canonical + ".__init__";
                if (api.element(init).filter(ApiElement::isCallable).isPresent()) {
                    return new Callee(new CallTarget.Resolved(init), canonical);
                }
                return new Callee(new CallTarget.Unresolved(CallTarget.Reason.NO_CONSTRUCTOR), canonical);
            }
            return Callee.unresolved(CallTarget.Reason.NOT_IN_API);
        }

        // ---- bindings ----

        private void assign(TSNode assignment) {
            Binding value = assignedValue(assignment);
            if (value != null) {
                bindTarget(assignment.getChildByFieldName("left"), value);
            } else {
                // Annotation without a value binds nothing
                visitTargetExpressions(assignment.getChildByFieldName("left"));
            }
        }

        /** Value bound by {@code assignment}, following chains like {@code a = b = np.zeros}. */
        private Binding assignedValue(TSNode assignment) {
            TSNode right = assignment.getChildByFieldName("right");
            if (right.isNull()) {
                return null;
            }
            if (ASSIGNMENT.equals(right.getType())) {
                Binding value = assignedValue(right);
                if (value != null) bindTarget(right.getChildByFieldName("left"), value);
                return value;
            }
            visit(right);
            Binding reference = aliases.referenceBinding(right);
            if (reference != null) {
                return reference;
            }
            if (inferInstances && CALL.equals(right.getType())) {
                TSNode function = right.getChildByFieldName("function");
                if (!function.isNull()) {
                    String constructed = resolveCallee(function).constructedClass();
                    if (constructed != null) return new Binding.Instance(constructed);
                }
            }
            return Binding.SHADOWED;
        }

        /**
         * Binds every name of an assignment target. Names inside unpacking patterns are
         * shadowed; attribute and subscript targets bind nothing but may contain calls.
         */
        private void bindTarget(TSNode target, Binding value) {
            if (target == null || target.isNull()) return;
            switch (target.getType()) {
                case IDENTIFIER:
                    table.bind(src.text(target), value);
                    break;
                case PARENTHESIZED:
                    if (target.getNamedChildCount() == 1) {
                        bindTarget(target.getNamedChild(0), value);
                        break;
                    }
                    bindAllShadowed(target);
                    break;
                case "pattern_list":
                case "tuple_pattern":
                case "list_pattern":
                case TUPLE:
                case LIST:
                case LIST_SPLAT_PATTERN:
                case LIST_SPLAT:
                case "expression_list":
                    bindAllShadowed(target);
                    break;
                default:
                    visit(target);
            }
        }

        private void bindAllShadowed(TSNode pattern) {
            for (int i = 0; i < pattern.getNamedChildCount(); i++) {
                bindTarget(pattern.getNamedChild(i), Binding.SHADOWED);
            }
        }

        private void visitTargetExpressions(TSNode target) {
            if (target != null && !target.isNull() && !IDENTIFIER.equals(target.getType())) {
                visit(target);
            }
        }

        private void visitDelete(TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode target = node.getNamedChild(i);
                if (IDENTIFIER.equals(target.getType())) {
                    table.bind(src.text(target), Binding.SHADOWED);
                } else if ("expression_list".equals(target.getType())) {
                    visitDelete(target);
                } else {
                    visit(target);
                }
            }
        }

        private void forEachIdentifier(TSNode node, Consumer<String> action) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (IDENTIFIER.equals(child.getType())) action.accept(src.text(child));
            }
        }

        // ---- scopes ----

        private void visitFunction(TSNode function) {
            TSNode name = function.getChildByFieldName("name");
            TSNode parameters = function.getChildByFieldName("parameters");
            List<String> parameterNames = visitParameters(parameters);
            if (!name.isNull()) {
                table.bind(src.text(name), Binding.SHADOWED);
            }
            table.enter(Scope.Kind.FUNCTION);
            for (String p : parameterNames) table.bind(p, Binding.SHADOWED);
            visit(function.getChildByFieldName("body"));
            table.exit();
        }

        private void visitLambda(TSNode lambda) {
            List<String> parameterNames = visitParameters(lambda.getChildByFieldName("parameters"));
            table.enter(Scope.Kind.LAMBDA);
            for (String p : parameterNames) table.bind(p, Binding.SHADOWED);
            visit(lambda.getChildByFieldName("body"));
            table.exit();
        }

        /** Visits default values in the enclosing scope and returns the declared names. */
        private List<String> visitParameters(TSNode parameters) {
            List<String> names = new ArrayList<>();
            if (parameters == null || parameters.isNull()) return names;
            for (int i = 0; i < parameters.getNamedChildCount(); i++) {
                TSNode p = parameters.getNamedChild(i);
                switch (p.getType()) {
                    case IDENTIFIER:
                        names.add(src.text(p));
                        break;
                    case DEFAULT_PARAMETER:
                    case TYPED_DEFAULT_PARAMETER: {
                        TSNode pname = p.getChildByFieldName("name");
                        if (!pname.isNull()) names.add(src.text(pname));
                        visit(p.getChildByFieldName("value"));
                        break;
                    }
                    case TYPED_PARAMETER:
                    case LIST_SPLAT_PATTERN:
                    case DICTIONARY_SPLAT_PATTERN:
                        for (int j = 0; j < p.getNamedChildCount(); j++) {
                            TSNode inner = p.getNamedChild(j);
                            if (IDENTIFIER.equals(inner.getType())) {
                                names.add(src.text(inner));
                                break;
                            }
                            if (LIST_SPLAT_PATTERN.equals(inner.getType())
                                    || DICTIONARY_SPLAT_PATTERN.equals(inner.getType())) {
                                names.addAll(splatNames(inner));
                                break;
                            }
                        }
                        break;
                    default:
                        break;
                }
            }
            return names;
        }

        private List<String> splatNames(TSNode splat) {
            List<String> names = new ArrayList<>();
            for (int j = 0; j < splat.getNamedChildCount(); j++) {
                TSNode inner = splat.getNamedChild(j);
                if (IDENTIFIER.equals(inner.getType())) names.add(src.text(inner));
            }
            return names;
        }

        private void visitClass(TSNode cls) {
            visit(cls.getChildByFieldName("superclasses"));
            table.enter(Scope.Kind.CLASS);
            visit(cls.getChildByFieldName("body"));
            table.exit();
            TSNode name = cls.getChildByFieldName("name");
            if (!name.isNull()) {
                table.bind(src.text(name), Binding.SHADOWED);
            }
        }

        private void visitComprehension(TSNode comprehension) {
            List<TSNode> clauses = new ArrayList<>();
            for (int i = 0; i < comprehension.getNamedChildCount(); i++) {
                TSNode child = comprehension.getNamedChild(i);
                if (FOR_IN_CLAUSE.equals(child.getType()) || IF_CLAUSE.equals(child.getType())) {
                    clauses.add(child);
                }
            }
            boolean first = true;
            // The outermost iterable is evaluated in the enclosing scope
            for (TSNode clause : clauses) {
                if (FOR_IN_CLAUSE.equals(clause.getType())) {
                    visitIterables(clause);
                    break;
                }
            }
            table.enter(Scope.Kind.COMPREHENSION);
            for (TSNode clause : clauses) {
                if (FOR_IN_CLAUSE.equals(clause.getType())) {
                    if (!first) visitIterables(clause);
                    first = false;
                    bindTarget(clause.getChildByFieldName("left"), Binding.SHADOWED);
                } else {
                    visitChildren(clause);
                }
            }
            visit(comprehension.getChildByFieldName("body"));
            table.exit();
        }

        private void visitIterables(TSNode forInClause) {
            TSNode left = forInClause.getChildByFieldName("left");
            for (int i = 0; i < forInClause.getNamedChildCount(); i++) {
                TSNode child = forInClause.getNamedChild(i);
                if (left.isNull() || !AliasResolver.sameNode(child, left)) visit(child);
            }
        }

        // ---- control flow ----

        private void visitIf(TSNode node) {
            visit(node.getChildByFieldName("condition"));
            AliasTable.Snapshot base = table.snapshot();
            List<AliasTable.Snapshot> outcomes = new ArrayList<>();
            visit(node.getChildByFieldName("consequence"));
            outcomes.add(table.snapshot());
            boolean hasElse = false;
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (ELIF.equals(child.getType())) {
                    table.restore(base);
                    visit(child.getChildByFieldName("condition"));
                    visit(child.getChildByFieldName("consequence"));
                    outcomes.add(table.snapshot());
                } else if (ELSE.equals(child.getType())) {
                    table.restore(base);
                    visit(child.getChildByFieldName("body"));
                    outcomes.add(table.snapshot());
                    hasElse = true;
                }
            }
            if (!hasElse) outcomes.add(base);
            table.restore(AliasTable.merge(outcomes));
        }

        private void visitFor(TSNode node) {
            visit(node.getChildByFieldName("right"));
            AliasTable.Snapshot base = table.snapshot();
            bindTarget(node.getChildByFieldName("left"), Binding.SHADOWED);
            visit(node.getChildByFieldName("body"));
            table.restore(AliasTable.merge(List.of(base, table.snapshot())));
            visitElse(node.getChildByFieldName("alternative"));
        }

        private void visitWhile(TSNode node) {
            visit(node.getChildByFieldName("condition"));
            AliasTable.Snapshot base = table.snapshot();
            visit(node.getChildByFieldName("body"));
            table.restore(AliasTable.merge(List.of(base, table.snapshot())));
            visitElse(node.getChildByFieldName("alternative"));
        }

        private void visitElse(TSNode elseClause) {
            if (!elseClause.isNull()) visit(elseClause.getChildByFieldName("body"));
        }

        private void visitTry(TSNode node) {
            AliasTable.Snapshot base = table.snapshot();
            List<AliasTable.Snapshot> outcomes = new ArrayList<>();
            visit(node.getChildByFieldName("body"));
            List<TSNode> handlers = new ArrayList<>();
            TSNode finallyClause = null;
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                switch (child.getType()) {
                    case EXCEPT:
                    case EXCEPT_GROUP:
                        handlers.add(child);
                        break;
                    case ELSE:
                        visit(child.getChildByFieldName("body"));
                        break;
                    case FINALLY:
                        finallyClause = child;
                        break;
                    default:
                        break;
                }
            }
            outcomes.add(table.snapshot());
            for (TSNode handler : handlers) {
                table.restore(base);
                visitHandler(handler);
                outcomes.add(table.snapshot());
            }
            table.restore(AliasTable.merge(outcomes));
            if (finallyClause != null) visitChildren(finallyClause);
        }

        /** {@code except E as e:} binds {@code e} in the handler path. */
        private void visitHandler(TSNode handler) {
            boolean afterAs = false;
            for (int i = 0; i < handler.getChildCount(); i++) {
                TSNode child = handler.getChild(i);
                String type = child.getType();
                if ("as".equals(type)) {
                    afterAs = true;
                } else if (!child.isNamed()) {
                    continue;
                } else if (afterAs) {
                    bindTarget(child, Binding.SHADOWED);
                    afterAs = false;
                } else if (AS_PATTERN.equals(type)) {
                    visitAsPattern(child);
                } else {
                    visit(child);
                }
            }
        }

        private void visitWith(TSNode node) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (WITH_CLAUSE.equals(child.getType())) {
                    for (int j = 0; j < child.getNamedChildCount(); j++) {
                        TSNode item = child.getNamedChild(j);
                        if (!WITH_ITEM.equals(item.getType())) continue;
                        TSNode value = item.getChildByFieldName("value");
                        if (!value.isNull() && AS_PATTERN.equals(value.getType())) {
                            visitAsPattern(value);
                        } else {
                            visit(value);
                        }
                    }
                }
            }
            AliasTable.Snapshot base = table.snapshot();
            visit(node.getChildByFieldName("body"));
            table.restore(AliasTable.merge(List.of(base, table.snapshot())));
        }

        /** {@code expr as target}: visits the expression, then shadows the target's names. */
        private void visitAsPattern(TSNode asPattern) {
            TSNode alias = asPattern.getChildByFieldName("alias");
            for (int i = 0; i < asPattern.getNamedChildCount(); i++) {
                TSNode child = asPattern.getNamedChild(i);
                if (!alias.isNull() && AliasResolver.sameNode(child, alias)) continue;
                visit(child);
            }
            if (alias.isNull()) return;
            if (AS_PATTERN_TARGET.equals(alias.getType())) {
                bindAllShadowed(alias);
            } else {
                bindTarget(alias, Binding.SHADOWED);
            }
        }

        private void visitMatch(TSNode node) {
            visit(node.getChildByFieldName("subject"));
            AliasTable.Snapshot base = table.snapshot();
            List<AliasTable.Snapshot> outcomes = new ArrayList<>();
            outcomes.add(base);
            TSNode body = node.getChildByFieldName("body");
            if (!body.isNull()) {
                for (int i = 0; i < body.getNamedChildCount(); i++) {
                    TSNode clause = body.getNamedChild(i);
                    if (!CASE.equals(clause.getType())) continue;
                    table.restore(base);
                    visitChildren(clause);
                    outcomes.add(table.snapshot());
                }
            }
            table.restore(AliasTable.merge(outcomes));
        }
    }
}
