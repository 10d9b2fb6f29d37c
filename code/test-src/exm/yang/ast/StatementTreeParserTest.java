package exm.yang.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.yang.common.Logging;
import exm.yang.common.exceptions.ParserException;
import exm.yang.common.exceptions.UserException;
import exm.yang.lexer.Lexer;
import exm.yang.lexer.SourcePosition;

public class StatementTreeParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("StatementTreeParserTest.yang.log", true);
  }

  private static UnprocessedStatement parse(String input)
      throws UserException {
    return StatementTreeParser.parseDocument(new Lexer(input, "t.yang", 8));
  }

  @Test
  public void testLeafStatement() throws UserException {
    UnprocessedStatement stmt = parse("prefix sports;");
    assertEquals("prefix", stmt.getIdentifier().content());
    assertEquals("sports", stmt.getArgument());
    assertFalse(stmt.hasPrefix());
    assertTrue(stmt.subStatements().isEmpty());
  }

  @Test
  public void testNoArgument() throws UserException {
    UnprocessedStatement stmt = parse("input { }");
    assertNull(stmt.getArgument());
    assertTrue(stmt.isEmpty());
  }

  @Test
  public void testNested() throws UserException {
    UnprocessedStatement stmt = parse(
        "leaf birthday {\n" +
        "  type yang:date-and-time;\n" +
        "  must \"a\";\n" +
        "  ext:note \"x\" { must b; }\n" +
        "  must 'c';\n" +
        "}");
    assertEquals(6, StatementTreeParser.treeSize(stmt));

    List<UnprocessedStatement> musts = stmt.subStatements("must");
    assertEquals(2, musts.size());
    assertEquals("a", musts.get(0).getArgument());
    assertEquals("c", musts.get(1).getArgument());

    UnprocessedStatement note = stmt.subStatements("note:ext").get(0);
    assertEquals("ext", note.getPrefix());
    assertEquals("note", note.getIdentifier().content());
    assertEquals(1, note.subStatements("must").size());

    assertEquals("yang:date-and-time",
                 stmt.subStatements("type").get(0).getArgument());
    assertEquals(new SourcePosition("t.yang", 2, 3),
                 stmt.subStatements("type").get(0).getPosition());
  }

  @Test
  public void testPrefixSplitsOnFirstColon() throws UserException {
    UnprocessedStatement stmt = parse("a:b:c;");
    assertEquals("a", stmt.getPrefix());
    assertEquals("b:c", stmt.getIdentifier().content());
  }

  @Test
  public void testEmptyPrefix() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("empty prefix");
    parse(":b;");
  }

  @Test
  public void testParseStatementStopsAtBlockEnd() throws UserException {
    Lexer lexer = new Lexer("}");
    assertNull(StatementTreeParser.parseStatement(lexer));
    assertNull(StatementTreeParser.parseStatement(new Lexer("")));
  }

  @Test
  public void testMissingTerminator() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("unexpected end of statement 'leaf'");
    parse("leaf x }");
  }

  @Test
  public void testMissingTerminatorAtEnd() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("t.yang:1:7:");
    parse("leaf x");
  }

  @Test
  public void testUnclosedBlock() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("expected '}' to close 'container'");
    parse("container c { leaf x; ");
  }

  @Test
  public void testStrayTokenInBlock() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("expected '}' to close 'container'");
    parse("container c { ; }");
  }

  @Test
  public void testTrailingStatement() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("after end of 'module'");
    parse("module a { } module b { }");
  }

  @Test
  public void testStrayBlockEnd() throws UserException {
    exception.expect(ParserException.class);
    parse("module a { } }");
  }

  @Test
  public void testMaxDepth() throws UserException {
    String input = "a { b { c { d; } } }";
    assertEquals(4, StatementTreeParser.treeSize(
        StatementTreeParser.parseDocument(new Lexer(input), 3)));
    exception.expect(ParserException.class);
    exception.expectMessage("<input>:1:13: statement 'd' is nested deeper"
                            + " than 2 levels");
    StatementTreeParser.parseDocument(new Lexer(input), 2);
  }

  @Test
  public void testEmptyDocument() throws UserException {
    exception.expect(ParserException.class);
    exception.expectMessage("expected a statement");
    parse("  // nothing here\n");
  }
}
