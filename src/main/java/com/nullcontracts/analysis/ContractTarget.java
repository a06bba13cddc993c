package com.nullcontracts.analysis;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.util.Optional;

/**
 * Where the contract statements for an annotated member live: the member
 * itself, the implementing member of its companion type, or nowhere.
 */
public final class ContractTarget {

    public enum Kind { SELF, REDIRECT, UNFIXABLE }

    private static final ContractTarget UNFIXABLE = new ContractTarget(Kind.UNFIXABLE, null);

    private final Kind kind;
    private final CallableDeclaration<?> member;

    private ContractTarget(Kind kind, CallableDeclaration<?> member) {
        this.kind = kind;
        this.member = member;
    }

    public static ContractTarget self(CallableDeclaration<?> member) {
        return new ContractTarget(Kind.SELF, member);
    }

    public static ContractTarget redirect(CallableDeclaration<?> companionMember) {
        return new ContractTarget(Kind.REDIRECT, companionMember);
    }

    public static ContractTarget unfixable() {
        return UNFIXABLE;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFixable() {
        return kind != Kind.UNFIXABLE;
    }

    /**
     * The statement-bearing member.
     *
     * @throws IllegalStateException for an unfixable target
     */
    public CallableDeclaration<?> getMember() {
        if (member == null) {
            throw new IllegalStateException("Unfixable target has no member");
        }
        return member;
    }

    /**
     * Body of the statement-bearing member; empty for an unfixable target.
     */
    public Optional<BlockStmt> getBody() {
        return bodyOf(member);
    }

    static Optional<BlockStmt> bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration) {
            return ((MethodDeclaration) callable).getBody();
        }
        if (callable instanceof ConstructorDeclaration) {
            return Optional.of(((ConstructorDeclaration) callable).getBody());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return member == null ? kind.name() : kind + "(" + member.getDeclarationAsString(false, false, false) + ")";
    }
}
