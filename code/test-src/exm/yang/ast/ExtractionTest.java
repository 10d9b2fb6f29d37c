package exm.yang.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.yang.common.Logging;
import exm.yang.common.exceptions.ParserException;
import exm.yang.frontend.tree.WhenStmt;

public class ExtractionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ExtractionTest.yang.log", true);
  }

  /** Takes the argument and the description only */
  private static final StatementParser<String> PARTIAL =
      new StatementParser<String>() {
    @Override
    public String parse(UnprocessedStatement stmt) throws ParserException {
      String arg = stmt.takeArgumentOrError();
      stmt.takeOptional("description");
      return arg;
    }
  };

  private static UnprocessedStatement buildWhen(boolean extra) {
    UnprocessedStatement when = new UnprocessedStatement(
                              new Identifier("when"), null, "../x = 1");
    when.add(new UnprocessedStatement(new Identifier("description"), null,
                                      "d"));
    if (extra) {
      when.add(new UnprocessedStatement(new Identifier("fake"), null,
                                        "this is quite wrong"));
    }
    return when;
  }

  @Test
  public void testResidual() throws ParserException {
    UnprocessedStatement when = buildWhen(true);
    Extraction.Extracted<String> result = Extraction.extract(when, PARTIAL);
    assertEquals("../x = 1", result.value());
    assertEquals(1, result.residual().subStatements().size());
    assertEquals("fake", result.residual().subStatements().get(0).getKey());

    // Source node is left alone
    assertEquals("../x = 1", when.getArgument());
    assertEquals(2, when.subStatements().size());
  }

  @Test
  public void testEnsureConsumed() throws ParserException {
    Extraction.Extracted<String> result =
        Extraction.extract(buildWhen(false), PARTIAL);
    Extraction.ensureConsumed(result.residual());
    assertTrue(result.residual().isEmpty());

    result = Extraction.extract(buildWhen(true), PARTIAL);
    exception.expect(ParserException.class);
    exception.expectMessage("fake");
    Extraction.ensureConsumed(result.residual());
  }

  @Test
  public void testExtractAll() throws ParserException {
    UnprocessedStatement when = buildWhen(false);
    WhenStmt stmt = Extraction.extractAll(when, WhenStmt.PARSER);
    assertEquals("../x = 1", stmt.getCondition());
    assertEquals("d", stmt.getDescription());
    assertEquals(1, when.subStatements().size());

    // Reentrant: the same node can be extracted again
    assertEquals("../x = 1",
                 Extraction.extractAll(when, WhenStmt.PARSER).getCondition());
  }

  @Test
  public void testExtractAllRejectsUnknown() throws ParserException {
    exception.expect(ParserException.class);
    Extraction.extractAll(buildWhen(true), WhenStmt.PARSER);
  }
}
