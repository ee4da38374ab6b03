package com.astrepr.ast;

/**
 * Base interface for canonical AST nodes.
 *
 * Every node kind the code generator knows how to render has its own record with named
 * roles for its parts. Anything else, including known kinds whose children do not have the
 * expected shape, is carried as {@link Other}.
 */
public sealed interface Node permits
    SourceFile,
    PackageSpec,
    ImportSpec,
    ClassDecl,
    MainDecl,
    FuncDecl,
    FuncParam,
    VarDecl,
    Expression,
    MatchCase,
    CatchClause,
    TypeNode,
    CasePattern {

    /** Node kind as spelled in the dump, e.g. "FuncDecl". */
    String kind();

    /** Raw {@code position} property of the source node, or null. */
    String position();
}
