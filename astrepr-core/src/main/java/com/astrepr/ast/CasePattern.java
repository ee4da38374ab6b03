package com.astrepr.ast;

/**
 * Pattern of a {@link MatchCase}.
 */
public sealed interface CasePattern extends Node permits WildcardPattern, TypePattern, UnknownPattern {
}
