package com.astrepr.ast;

public sealed interface Expression extends Node permits
    Block,
    CallExpr,
    MemberAccess,
    RefExpr,
    LitConstExpr,
    AssignExpr,
    BinaryExpr,
    IfExpr,
    MatchExpr,
    LambdaExpr,
    TryExpr,
    ReturnExpr,
    ThrowExpr,
    Other {
}
