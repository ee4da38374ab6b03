package com.astrepr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineClassifierTest {

    @Test
    void testBlankAndCommentLines() {
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify(""));
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify("    "));
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify("  // just a comment"));
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify("something without structure"));
    }

    @Test
    void testClosers() {
        assertInstanceOf(LineToken.Close.class, LineClassifier.classify("  }"));
        assertInstanceOf(LineToken.ListEnd.class, LineClassifier.classify("\t]  "));
        assertInstanceOf(LineToken.Close.class, LineClassifier.classify("} // end of class"));
    }

    @Test
    void testListStart() {
        LineToken withColon = LineClassifier.classify("    arguments: [");
        LineToken withoutColon = LineClassifier.classify("matchCases [");

        assertEquals(new LineToken.ListStart("arguments"), withColon);
        assertEquals(new LineToken.ListStart("matchCases"), withoutColon);
    }

    @Test
    void testNodeOpenWithLabel() {
        assertEquals(new LineToken.NodeOpen("ClassDecl", "Foo"), LineClassifier.classify("  ClassDecl: Foo {"));
        assertEquals(new LineToken.NodeOpen("LitConstExpr", "String \"a b\""),
            LineClassifier.classify("LitConstExpr: String \"a b\" {"));
    }

    @Test
    void testNodeOpenWithoutLabel() {
        assertEquals(new LineToken.NodeOpen("Block", ""), LineClassifier.classify("Block {"));
        assertEquals(new LineToken.NodeOpen("RefType", ""), LineClassifier.classify("RefType: {"));
        // Doubled colon is tolerated
        assertEquals(new LineToken.NodeOpen("FuncBody", "x"), LineClassifier.classify("FuncBody:: x {"));
    }

    @Test
    void testNodeOpenSplitsOnLastWhitespaceWithoutColon() {
        assertEquals(new LineToken.NodeOpen("TypePattern", "Foo"), LineClassifier.classify("TypePattern   Foo {"));
    }

    @Test
    void testKeyValue() {
        assertEquals(new LineToken.KeyValue("position", "(1,1,1) (1,10,2)"),
            LineClassifier.classify("  position: (1,1,1) (1,10,2)  "));
        assertEquals(new LineToken.KeyValue("ty", "Class-Foo<Int64>: x"),
            LineClassifier.classify("ty: Class-Foo<Int64>: x"));
    }

    @Test
    void testLowercaseKeyIsNeverAnInlineNode() {
        LineToken token = LineClassifier.classify("ty: Foo { x }");

        assertEquals(new LineToken.KeyValue("ty", "Foo { x }"), token);
    }

    @Test
    void testInlineNode() {
        LineToken token = LineClassifier.classify("WildcardPattern: _ { position: (3,5,1) }");

        LineToken.InlineNode inline = assertInstanceOf(LineToken.InlineNode.class, token);
        assertEquals("WildcardPattern", inline.kind());
        assertEquals("_", inline.label());
        assertEquals(new LineToken.KeyValue("position", "(3,5,1)"), inline.body());
    }

    @Test
    void testInlineNodeWithEmptyBody() {
        LineToken.InlineNode inline = assertInstanceOf(LineToken.InlineNode.class,
            LineClassifier.classify("RefExpr: x { }"));

        assertInstanceOf(LineToken.Comment.class, inline.body());
    }

    @Test
    void testStripCommentRespectsStrings() {
        assertEquals("value: \"http://x\"", LineClassifier.stripComment("value: \"http://x\" // trailing"));
        assertEquals("value: \"a\\\"//b\"", LineClassifier.stripComment("value: \"a\\\"//b\""));
        assertEquals("", LineClassifier.stripComment("// all comment"));
    }

    @Test
    void testNodeOpenWithoutKindIsComment() {
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify(": {"));
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify("  : x {"));
        assertInstanceOf(LineToken.Comment.class, LineClassifier.classify(":: x {"));
    }

    @Test
    void testInlineNodeWithBraceInsideString() {
        LineToken.InlineNode inline = assertInstanceOf(LineToken.InlineNode.class,
            LineClassifier.classify("LitConstExpr: String \"a {b}\" { }"));

        assertEquals("LitConstExpr", inline.kind());
        assertEquals("String \"a {b}\"", inline.label());
    }
}
