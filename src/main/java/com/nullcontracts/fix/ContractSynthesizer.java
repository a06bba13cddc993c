package com.nullcontracts.fix;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.nullcontracts.analysis.ContractClassResolver;
import com.nullcontracts.analysis.ContractExpressions;
import com.nullcontracts.analysis.ContractTarget;
import com.nullcontracts.config.ContractConfiguration;
import com.nullcontracts.model.ContractKind;
import com.nullcontracts.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Inserts the contract statement missing for one finding.
 *
 * {@link #apply(CompilationUnit, Node)} never modifies its input: the compilation
 * unit is cloned, the anchor is located in the clone and only the clone is edited.
 * {@link #applyInPlace(CompilationUnit, Node)} edits the given tree, which keeps
 * a {@link com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter}
 * set up on it working.
 */
public class ContractSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ContractSynthesizer.class);

    private final ContractExpressions expressions;
    private final ContractClassResolver classResolver;
    private final ContractConfiguration config;

    public ContractSynthesizer(ContractExpressions expressions) {
        this.expressions = expressions;
        this.classResolver = new ContractClassResolver(expressions);
        this.config = expressions.getConfig();
    }

    public CompilationUnit apply(CompilationUnit root, Finding finding) {
        return apply(root, finding.getAnchor());
    }

    /**
     * Adds the contract statement for the annotated subject at {@code anchor}.
     *
     * @param root The compilation unit containing the anchor
     * @param anchor A {@link Parameter}, {@link MethodDeclaration} or field {@link VariableDeclarator}
     * @return A new compilation unit with the statement (and import) added, or {@code root}
     */
    public CompilationUnit apply(CompilationUnit root, Node anchor) {
        if (!belongsTo(anchor, root)) {
            return root;
        }

        CompilationUnit copy = root.clone();
        Optional<Node> located = NodePath.of(anchor).locate(copy);
        if (located.isEmpty()) {
            logger.debug("Anchor {} not found in the cloned tree", anchor.getClass().getSimpleName());
            return root;
        }
        return insert(copy, located.get()) ? copy : root;
    }

    /**
     * Adds the contract statement for {@code anchor} directly to {@code root}.
     *
     * @param root The compilation unit containing the anchor; modified
     * @param anchor As for {@link #apply(CompilationUnit, Node)}
     * @return true if a statement was inserted
     */
    public boolean applyInPlace(CompilationUnit root, Node anchor) {
        return belongsTo(anchor, root) && insert(root, anchor);
    }

    private boolean insert(CompilationUnit root, Node target) {
        Expression scope = contractScope(root);
        boolean changed;
        if (target instanceof Parameter) {
            changed = addRequires((Parameter) target, scope);
        } else if (target instanceof MethodDeclaration) {
            changed = addEnsures((MethodDeclaration) target, scope);
        } else if (target instanceof VariableDeclarator) {
            changed = addInvariant((VariableDeclarator) target, scope);
        } else {
            changed = false;
        }
        if (changed) {
            ContractExpressions.addImportIfMissing(root, config.getContractClassName());
        }
        return changed;
    }

    /**
     * The simple contract class name, or the qualified one when the simple name
     * already denotes another type in this document.
     */
    private Expression contractScope(CompilationUnit root) {
        String qualified = config.getContractClassName();
        if (!ContractExpressions.hasImportConflict(root, qualified)) {
            return new NameExpr(config.getContractClassSimpleName());
        }
        logger.debug("{} is taken in this document, writing {}", config.getContractClassSimpleName(), qualified);
        Expression scope = null;
        for (String part : qualified.split("\\.")) {
            scope = scope == null ? new NameExpr(part) : new FieldAccessExpr(scope, part);
        }
        return scope;
    }

    private static boolean belongsTo(Node anchor, CompilationUnit root) {
        if (anchor.findCompilationUnit().map(cu -> cu != root).orElse(true)) {
            logger.debug("Anchor {} is not part of the given compilation unit", anchor.getClass().getSimpleName());
            return false;
        }
        return true;
    }

    private boolean addRequires(Parameter parameter, Expression scope) {
        Optional<Node> parent = parameter.getParentNode();
        if (parent.isEmpty() || !(parent.get() instanceof CallableDeclaration)) {
            return false;
        }
        CallableDeclaration<?> callable = (CallableDeclaration<?>) parent.get();
        int position = indexOf(callable.getParameters(), parameter);

        ContractTarget target = classResolver.resolveContractTarget(callable);
        if (!target.isFixable() || position < 0) {
            return false;
        }
        CallableDeclaration<?> member = target.getMember();
        Parameter targetParameter = member.getParameter(position);
        BlockStmt body = target.getBody().orElseThrow();

        Set<Node> parametersBefore = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < position; i++) {
            parametersBefore.add(member.getParameter(i));
        }

        // Skip the leading preconditions that check earlier parameters
        NodeList<Statement> statements = body.getStatements();
        int index = 0;
        while (index < statements.size()) {
            Optional<MethodCallExpr> call = expressions.asContractCall(statements.get(index), ContractKind.REQUIRES);
            if (call.isEmpty()) {
                break;
            }
            boolean earlier = expressions.resolveReferencedDeclaration(call.get())
                    .map(parametersBefore::contains)
                    .orElse(false);
            if (!earlier) {
                break;
            }
            index++;
        }

        statements.add(index, contractStatement(scope, config.getRequiresMethod(),
                notNull(new NameExpr(targetParameter.getNameAsString()))));
        logger.debug("Added precondition for {} at index {} of {}", targetParameter.getNameAsString(), index,
                member.getNameAsString());
        return true;
    }

    private boolean addEnsures(MethodDeclaration method, Expression scope) {
        ContractTarget target = classResolver.resolveContractTarget(method);
        if (!target.isFixable()) {
            return false;
        }
        MethodDeclaration member = (MethodDeclaration) target.getMember();
        BlockStmt body = target.getBody().orElseThrow();

        NodeList<Statement> statements = body.getStatements();
        int index = 0;
        while (index < statements.size()
                && expressions.asContractCall(statements.get(index), ContractKind.REQUIRES).isPresent()) {
            index++;
        }

        // Declared type of the member receiving the statement, as written there
        Type returnType = member.getType().clone();
        MethodCallExpr result = new MethodCallExpr(scope.clone(), config.getResultMethod());
        result.setTypeArguments(new NodeList<>(returnType));

        statements.add(index, contractStatement(scope, config.getEnsuresMethod(), notNull(result)));
        logger.debug("Added postcondition to {} at index {}", member.getNameAsString(), index);
        return true;
    }

    private boolean addInvariant(VariableDeclarator variable, Expression scope) {
        Optional<Node> field = variable.getParentNode();
        if (field.isEmpty() || !(field.get() instanceof FieldDeclaration)) {
            return false;
        }
        Optional<Node> owner = field.get().getParentNode();
        if (owner.isEmpty() || !(owner.get() instanceof TypeDeclaration)) {
            return false;
        }
        Optional<MethodDeclaration> invariantMethod = classResolver.findInvariantMethod((TypeDeclaration<?>) owner.get());
        if (invariantMethod.isEmpty()) {
            return false;
        }

        BlockStmt body = invariantMethod.get().getBody().orElseThrow();
        NameExpr checked = new NameExpr(variable.getNameAsString());
        Statement statement = contractStatement(scope, config.getInvariantMethod(), notNull(checked));
        body.addStatement(statement);

        // A local of the invariant method may shadow the field
        boolean bindsToField = expressions.getResolver().resolveDeclaration(checked)
                .map(declaration -> declaration == variable)
                .orElse(false);
        if (!bindsToField) {
            checked.replace(new FieldAccessExpr(new ThisExpr(), variable.getNameAsString()));
        }
        logger.debug("Added invariant for {} to {}", variable.getNameAsString(), invariantMethod.get().getNameAsString());
        return true;
    }

    private static Statement contractStatement(Expression scope, String method, Expression condition) {
        return new ExpressionStmt(new MethodCallExpr(scope.clone(), method, new NodeList<>(condition)));
    }

    private static Expression notNull(Expression checked) {
        return new BinaryExpr(checked, new NullLiteralExpr(), BinaryExpr.Operator.NOT_EQUALS);
    }

    private static int indexOf(List<Parameter> parameters, Parameter parameter) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i) == parameter) {
                return i;
            }
        }
        return -1;
    }
}
