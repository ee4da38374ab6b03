package com.astrepr.ast;

/**
 * Type annotation: a parameter type, a return type, a variable type or an inherited type.
 */
public sealed interface TypeNode extends Node permits RefType, PrimitiveType {
}
