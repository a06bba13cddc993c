package com.nullcontracts.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.nullcontracts.config.ContractConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Follows the {@code @ContractClass}/{@code @ContractClassFor} pair from a
 * bodiless member to the companion member that carries its contracts.
 * Shared by the analyzer and the synthesizer so both redirect identically.
 */
public class ContractClassResolver {

    private static final Logger logger = LoggerFactory.getLogger(ContractClassResolver.class);

    private final ContractExpressions expressions;
    private final ContractConfiguration config;
    private final SymbolResolver resolver;

    public ContractClassResolver(ContractExpressions expressions) {
        this.expressions = expressions;
        this.config = expressions.getConfig();
        this.resolver = expressions.getResolver();
    }

    /**
     * Determines which member receives the contract statements for {@code member}.
     *
     * @param member A method or constructor
     * @return SELF when it has a body, REDIRECT to the companion's implementing
     *         member when one with a body exists, UNFIXABLE otherwise
     */
    public ContractTarget resolveContractTarget(CallableDeclaration<?> member) {
        if (ContractTarget.bodyOf(member).isPresent()) {
            return ContractTarget.self(member);
        }

        Optional<CallableDeclaration<?>> implementing = getContractClass(member)
                .flatMap(companion -> findImplementingMember(companion, member));

        if (implementing.isPresent()) {
            logger.debug("Contracts for {} are placed on {}", member.getNameAsString(),
                    implementing.get().getDeclarationAsString(false, false, false));
            return ContractTarget.redirect(implementing.get());
        }

        logger.debug("No contract-bearing member for {}", member.getNameAsString());
        return ContractTarget.unfixable();
    }

    /**
     * Locates the companion type of the member's declaring type.
     * The companion must point back with {@code @ContractClassFor} and must
     * extend or implement the declaring type.
     *
     * @param member A member of an interface or abstract class
     * @return The companion type declaration
     */
    public Optional<TypeDeclaration<?>> getContractClass(CallableDeclaration<?> member) {
        Optional<Node> parent = member.getParentNode();
        if (parent.isEmpty() || !(parent.get() instanceof TypeDeclaration)) {
            return Optional.empty();
        }
        TypeDeclaration<?> contracted = (TypeDeclaration<?>) parent.get();

        Optional<TypeDeclaration<?>> companion = expressions.findMarker(contracted, config.getContractClassAnnotation())
                .flatMap(this::classLiteralType)
                .flatMap(resolver::resolveType);

        if (companion.isEmpty()) {
            return Optional.empty();
        }

        boolean pointsBack = expressions.findMarker(companion.get(), config.getContractClassForAnnotation())
                .flatMap(this::classLiteralType)
                .flatMap(resolver::resolveType)
                .map(type -> type == contracted)
                .orElse(false);
        if (!pointsBack) {
            logger.debug("Companion {} does not declare itself for {}", companion.get().getNameAsString(),
                    contracted.getNameAsString());
            return Optional.empty();
        }

        if (!inherits(companion.get(), contracted)) {
            logger.debug("Companion {} does not implement {}", companion.get().getNameAsString(),
                    contracted.getNameAsString());
            return Optional.empty();
        }
        return companion;
    }

    /**
     * Finds the member of the companion that implements {@code source}: same name and
     * the same parameter types once the type variables of the contracted type are
     * replaced by the type arguments the companion supplies for them.
     *
     * @param companion The companion type
     * @param source The bodiless member
     * @return The implementing member, only if it has a body
     */
    public Optional<CallableDeclaration<?>> findImplementingMember(TypeDeclaration<?> companion,
                                                                    CallableDeclaration<?> source) {
        if (!(source instanceof MethodDeclaration)) {
            return Optional.empty();
        }
        Map<String, String> typeArguments = typeArgumentsFor(companion, source);
        for (MethodDeclaration candidate : companion.getMethodsByName(source.getNameAsString())) {
            if (candidate.isStatic() || candidate.getBody().isEmpty()) {
                continue;
            }
            Map<String, String> substitution = new HashMap<>(typeArguments);
            bindMethodTypeParameters(source, candidate, substitution);
            if (sameSignature(candidate, source, substitution)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * The method holding the class invariants: the first one marked with the
     * invariant marker that takes no parameters and has a body.
     *
     * @param type The class
     * @return The invariant method
     */
    public Optional<MethodDeclaration> findInvariantMethod(TypeDeclaration<?> type) {
        for (MethodDeclaration method : type.getMethods()) {
            if (expressions.hasMarker(method, config.getInvariantMethodAnnotation())
                    && method.getParameters().isEmpty()
                    && method.getBody().isPresent()) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    private boolean inherits(TypeDeclaration<?> companion, TypeDeclaration<?> contracted) {
        return companion instanceof ClassOrInterfaceDeclaration
                && supertypeNaming((ClassOrInterfaceDeclaration) companion, contracted).isPresent();
    }

    private Optional<ClassOrInterfaceType> classLiteralType(AnnotationExpr annotation) {
        Expression value = null;
        if (annotation instanceof SingleMemberAnnotationExpr) {
            value = ((SingleMemberAnnotationExpr) annotation).getMemberValue();
        } else if (annotation instanceof NormalAnnotationExpr) {
            for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                if (pair.getNameAsString().equals("value")) {
                    value = pair.getValue();
                }
            }
        }
        if (!(value instanceof ClassExpr)) {
            return Optional.empty();
        }
        Type type = ((ClassExpr) value).getType();
        return type.isClassOrInterfaceType() ? Optional.of(type.asClassOrInterfaceType()) : Optional.empty();
    }

    /**
     * Maps the type parameters of the contracted type to what the companion's
     * {@code extends}/{@code implements} clause binds them to. A raw supertype
     * binds each parameter to its first bound, or {@code Object}.
     */
    private Map<String, String> typeArgumentsFor(TypeDeclaration<?> companion, CallableDeclaration<?> source) {
        Map<String, String> substitution = new HashMap<>();
        Optional<Node> parent = source.getParentNode();
        if (parent.isEmpty() || !(parent.get() instanceof ClassOrInterfaceDeclaration)
                || !(companion instanceof ClassOrInterfaceDeclaration)) {
            return substitution;
        }
        ClassOrInterfaceDeclaration contracted = (ClassOrInterfaceDeclaration) parent.get();
        NodeList<TypeParameter> typeParameters = contracted.getTypeParameters();
        if (typeParameters.isEmpty()) {
            return substitution;
        }

        Optional<ClassOrInterfaceType> supertype = supertypeNaming((ClassOrInterfaceDeclaration) companion, contracted);
        Optional<NodeList<Type>> arguments = supertype.flatMap(ClassOrInterfaceType::getTypeArguments);
        for (int i = 0; i < typeParameters.size(); i++) {
            TypeParameter parameter = typeParameters.get(i);
            if (arguments.isPresent() && arguments.get().size() == typeParameters.size()) {
                substitution.put(parameter.getNameAsString(), erasure(arguments.get().get(i)));
            } else {
                substitution.put(parameter.getNameAsString(), parameter.getTypeBound().isEmpty()
                        ? "Object"
                        : erasure(parameter.getTypeBound().get(0)));
            }
        }
        return substitution;
    }

    /**
     * Method type parameters match by position: {@code <T> void m(T t)} is implemented by {@code <U> void m(U u)}.
     */
    private static void bindMethodTypeParameters(CallableDeclaration<?> source, CallableDeclaration<?> candidate,
                                                 Map<String, String> substitution) {
        NodeList<TypeParameter> declared = source.getTypeParameters();
        NodeList<TypeParameter> implemented = candidate.getTypeParameters();
        if (declared.size() != implemented.size()) {
            return;
        }
        for (int i = 0; i < declared.size(); i++) {
            substitution.put(declared.get(i).getNameAsString(), implemented.get(i).getNameAsString());
        }
    }

    private Optional<ClassOrInterfaceType> supertypeNaming(ClassOrInterfaceDeclaration companion,
                                                           TypeDeclaration<?> contracted) {
        List<ClassOrInterfaceType> supertypes = new ArrayList<>(companion.getExtendedTypes());
        supertypes.addAll(companion.getImplementedTypes());
        for (ClassOrInterfaceType supertype : supertypes) {
            if (resolver.resolveType(supertype).map(t -> t == contracted).orElse(false)) {
                return Optional.of(supertype);
            }
        }
        return Optional.empty();
    }

    private static boolean sameSignature(CallableDeclaration<?> candidate, CallableDeclaration<?> source,
                                         Map<String, String> substitution) {
        List<Parameter> left = candidate.getParameters();
        List<Parameter> right = source.getParameters();
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (left.get(i).isVarArgs() != right.get(i).isVarArgs()) {
                return false;
            }
            if (!erasure(left.get(i).getType()).equals(erasure(right.get(i).getType(), substitution))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Simple name without type arguments, e.g. {@code java.util.List<T>} becomes {@code List}.
     */
    static String erasure(Type type) {
        return erasure(type, Collections.emptyMap());
    }

    /**
     * Erasure after replacing type variables, e.g. {@code T[]} with {@code T -> String} becomes {@code String[]}.
     */
    static String erasure(Type type, Map<String, String> substitution) {
        if (type.isArrayType()) {
            return erasure(type.asArrayType().getComponentType(), substitution) + "[]";
        }
        if (type.isClassOrInterfaceType()) {
            ClassOrInterfaceType classType = type.asClassOrInterfaceType();
            String name = classType.getNameAsString();
            if (classType.getScope().isEmpty() && substitution.containsKey(name)) {
                return substitution.get(name);
            }
            return name;
        }
        return type.asString();
    }
}
