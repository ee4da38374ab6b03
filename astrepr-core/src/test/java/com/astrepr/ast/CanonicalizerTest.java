package com.astrepr.ast;

import com.astrepr.ReprParser;
import com.astrepr.tree.ReprNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalizerTest {

    private static SourceFile canonicalize(String body) {
        return Canonicalizer.canonicalize(ReprParser.parse("File: test.cj {\n" + body + "\n}\n"));
    }

    private static Expression firstStatement(String statements) {
        SourceFile file = canonicalize("""
            MainDecl: {
              FuncDecl: main {
                FuncBody: {
                  Block: {
            """ + statements + """
                  }
                }
              }
            }
            """);
        MainDecl main = (MainDecl) file.items().get(0);
        return (Expression) main.body().statements().get(0);
    }

    @Test
    void testRejectsNonFileRoot() {
        assertThrows(IllegalArgumentException.class, () -> Canonicalizer.canonicalize(new ReprNode("Package", "p")));
    }

    @Test
    void testImportSpec() {
        SourceFile file = canonicalize("""
            ImportSpec: Foo {
              prefixPaths: std.foo
            }
            ImportSpec: {
              prefixPaths: std.collection
            }
            """);

        ImportSpec named = (ImportSpec) file.items().get(0);
        ImportSpec wildcard = (ImportSpec) file.items().get(1);
        assertEquals("std.foo", named.prefixPaths());
        assertEquals("Foo", named.item());
        assertFalse(named.isWildcard());
        assertTrue(wildcard.isWildcard());
    }

    @Test
    void testClassWithMembers() {
        SourceFile file = canonicalize("""
            ClassDecl: Point {
              position: (3,1,1)
              inheritedTypes: [
                RefType: Shape {
                }
              ]
              ClassBody: {
                VarDecl: x {
                  PrimitiveType: Int64 {
                  }
                }
                FuncDecl: init {
                  FuncBody: {
                    FuncParamList: {
                      FuncParam: x {
                        PrimitiveType: Int64 {
                        }
                      }
                    }
                    Block: {
                    }
                  }
                }
                PropDecl: size {
                }
              }
            }
            """);

        ClassDecl point = (ClassDecl) file.items().get(0);
        assertEquals("Point", point.name());
        assertEquals("(3,1,1)", point.position());
        assertEquals("Shape", ((RefType) point.inheritedTypes().get(0)).name());
        assertEquals(3, point.members().size());
        VarDecl x = (VarDecl) point.members().get(0);
        assertEquals("Int64", ((PrimitiveType) x.type()).name());
        assertNull(x.initializer());
        FuncDecl init = (FuncDecl) point.members().get(1);
        assertTrue(init.isInit());
        assertEquals("x", init.parameters().get(0).name());
        assertInstanceOf(Other.class, point.members().get(2));
    }

    @Test
    void testFunctionSignatureLabelIsShortened() {
        ReprNode node = ReprParser.parse("""
            File: f.cj {
              FuncDecl: foo (Int64) -> Unit {
              }
            }
            """).children().get(0);

        FuncDecl decl = Canonicalizer.funcDecl(node);
        assertEquals("foo", decl.name());
        assertNull(decl.returnType());
        assertNull(decl.body());
    }

    @Test
    void testUnknownTopLevelKind() {
        SourceFile file = canonicalize("""
            UnknowNode: {
              reason: desugared away
            }
            """);

        Other other = assertInstanceOf(Other.class, file.items().get(0));
        assertEquals("UnknowNode", other.kind());
    }

    @Test
    void testAssignWithTwoSides() {
        AssignExpr assign = assertInstanceOf(AssignExpr.class, firstStatement("""
            AssignExpr: {
              RefExpr: x { }
              LitConstExpr: Integer 1 {
              }
            }
            """));

        assertEquals("x", ((RefExpr) assign.left()).name());
        assertEquals("1", ((LitConstExpr) assign.right()).value());
    }

    @Test
    void testAssignWithOneSideKeepsRightOnly() {
        AssignExpr assign = assertInstanceOf(AssignExpr.class, firstStatement("""
            AssignExpr: {
              RefExpr: y { }
            }
            """));

        assertNull(assign.left());
        assertEquals("y", ((RefExpr) assign.right()).name());
    }

    @Test
    void testAssignWithThreeSidesIsMalformed() {
        Expression expression = firstStatement("""
            AssignExpr: {
              RefExpr: a { }
              RefExpr: b { }
              RefExpr: c { }
            }
            """);

        assertInstanceOf(Other.class, expression);
        assertEquals("AssignExpr", expression.kind());
    }

    @Test
    void testBinaryNeedsTwoOperands() {
        BinaryExpr binary = assertInstanceOf(BinaryExpr.class, firstStatement("""
            BinaryExpr: + {
              RefExpr: a { }
              RefExpr: b { }
            }
            """));
        assertEquals("+", binary.operator());

        assertInstanceOf(Other.class, firstStatement("""
            BinaryExpr: + {
              RefExpr: a { }
            }
            """));
    }

    @Test
    void testIfElseIfChain() {
        IfExpr ifExpr = assertInstanceOf(IfExpr.class, firstStatement("""
            IfExpr: {
              RefExpr: a { }
              Block: {
              }
              IfExpr: {
                RefExpr: b { }
                Block: {
                }
                Block: {
                }
              }
            }
            """));

        assertEquals("a", ((RefExpr) ifExpr.condition()).name());
        IfExpr elseIf = assertInstanceOf(IfExpr.class, ifExpr.elseBranch());
        assertInstanceOf(Block.class, elseIf.elseBranch());
    }

    @Test
    void testIfWithThreeBlocksIsMalformed() {
        assertInstanceOf(Other.class, firstStatement("""
            IfExpr: {
              Block: {
              }
              Block: {
              }
              Block: {
              }
            }
            """));
    }

    @Test
    void testCallWithoutCalleeIsMalformed() {
        assertInstanceOf(Other.class, firstStatement("""
            CallExpr: {
              arguments: [
              ]
            }
            """));
    }

    @Test
    void testCallThroughMemberAccess() {
        CallExpr call = assertInstanceOf(CallExpr.class, firstStatement("""
            CallExpr: {
              BaseFunc: {
                MemberAccess: {
                  field: append
                  RefExpr: list { }
                }
              }
              arguments: [
                FuncArg: {
                  RefExpr: item { }
                }
              ]
            }
            """));

        MemberAccess callee = assertInstanceOf(MemberAccess.class, call.callee());
        assertEquals("append", callee.field());
        assertEquals("list", ((RefExpr) callee.base()).name());
        assertEquals("item", ((RefExpr) call.arguments().get(0)).name());
    }

    @Test
    void testMatchCases() {
        MatchExpr match = assertInstanceOf(MatchExpr.class, firstStatement("""
            MatchExpr: {
              selector: {
                RefExpr: v { }
              }
              matchCases: [
                MatchCase: {
                  patterns: {
                    TypePattern: {
                      ty: Class-pkg-Circle
                      VarPattern: c { }
                    }
                  }
                  exprOrDecls: [
                    RefExpr: c { }
                  ]
                }
                MatchCase: {
                  patterns: {
                    WildcardPattern: _
                  }
                  Block: {
                    ReturnExpr: {
                    }
                  }
                }
              ]
            }
            """));

        assertEquals("v", ((RefExpr) match.selector()).name());
        assertEquals(2, match.cases().size());
        TypePattern typed = assertInstanceOf(TypePattern.class, match.cases().get(0).pattern());
        assertEquals("c", typed.binding());
        assertEquals("Circle", typed.typeName());
        WildcardPattern wildcard = assertInstanceOf(WildcardPattern.class, match.cases().get(1).pattern());
        assertEquals("_", wildcard.name());
        assertInstanceOf(ReturnExpr.class, match.cases().get(1).body().get(0));
    }

    @Test
    void testTryCatchFinally() {
        TryExpr tryExpr = assertInstanceOf(TryExpr.class, firstStatement("""
            TryExpr: {
              TryBlock: {
                Block: {
                  RefExpr: risky { }
                }
              }
              Catch: {
                CatchPattern: {
                  ExceptTypePattern: {
                    VarPattern: e { }
                    RefType: Exception {
                    }
                  }
                }
                CatchBlock: {
                  Block: {
                  }
                }
              }
              FinallyBlock: {
                Block: {
                }
              }
            }
            """));

        assertEquals(1, tryExpr.tryBlock().statements().size());
        CatchClause catchClause = tryExpr.catches().get(0);
        assertTrue(catchClause.hasPattern());
        assertEquals("e", catchClause.binding());
        assertEquals("Exception", catchClause.exceptionType());
        assertNotNull(tryExpr.finallyBlock());
    }

    @Test
    void testTypeNameFromTy() {
        assertEquals("Foo", Canonicalizer.typeNameFromTy("Class-Foo<Int64>"));
        assertEquals("Bar", Canonicalizer.typeNameFromTy(" pkg-Bar "));
        assertEquals("Int64", Canonicalizer.typeNameFromTy("Int64"));
    }
}
