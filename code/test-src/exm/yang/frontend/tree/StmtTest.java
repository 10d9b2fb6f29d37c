package exm.yang.frontend.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.yang.ast.Identifier;
import exm.yang.ast.StatementTreeParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.Logging;
import exm.yang.common.exceptions.ParserException;
import exm.yang.common.exceptions.UserException;
import exm.yang.lexer.Lexer;

/**
 * Tests for the statement parsers that build on the take operations
 */
public class StmtTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private UnprocessedStatement goodMust;
  private UnprocessedStatement goodLeaf;
  private UnprocessedStatement goodLeafList;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("StmtTest.yang.log", true);
  }

  static UnprocessedStatement stmt(String identifier, String argument) {
    return new UnprocessedStatement(new Identifier(identifier), null,
                                    argument);
  }

  private static UnprocessedStatement parseTree(String source)
      throws UserException {
    return StatementTreeParser.parseDocument(new Lexer(source, "t.yang", 8));
  }

  @Before
  public void buildStatements() {
    goodMust = stmt("must", "2 > 4");
    goodMust.add(stmt("error-message", "this is my error message"));
    goodMust.add(stmt("description", "this is my description"));

    goodLeaf = stmt("leaf", "identifier");
    goodLeaf.add(stmt("if-feature", "2 > 4"));
    goodLeaf.add(stmt("if-feature", "3 > 4"));
    goodLeaf.add(goodMust);
    goodLeaf.add(stmt("type", "string"));
    goodLeaf.add(stmt("status", "obsolete"));
    goodLeaf.add(stmt("config", "false"));

    goodLeafList = stmt("leaf-list", "leaflist");
    goodLeafList.add(stmt("type", "string"));
    goodLeafList.add(stmt("min-elements", "+34"));
    goodLeafList.add(stmt("max-elements", "53"));
    goodLeafList.add(stmt("ordered-by", "system"));
    goodLeafList.add(goodMust.copy());
  }

  @Test
  public void testGoodMust() throws ParserException {
    MustStmt must = MustStmt.parse(goodMust);
    assertEquals("2 > 4", must.getCondition());
    assertEquals("this is my description", must.getDescription());
    assertEquals("this is my error message", must.getErrorMessage());
    assertNull(must.getErrorAppTag());
    assertNull(must.getReference());
  }

  @Test
  public void testFullMust() throws ParserException {
    goodMust.add(stmt("error-app-tag", "tag"));
    goodMust.add(stmt("reference", "ref"));
    MustStmt must = MustStmt.parse(goodMust);
    assertEquals("tag", must.getErrorAppTag());
    assertEquals("ref", must.getReference());
  }

  @Test
  public void testMustMissingArgument() throws ParserException {
    exception.expect(ParserException.class);
    MustStmt.parse(new UnprocessedStatement(new Identifier("must")));
  }

  @Test
  public void testMustDuplicateDescription() throws ParserException {
    goodMust.add(stmt("description", "again"));
    exception.expect(ParserException.class);
    exception.expectMessage("at most one 'description'");
    MustStmt.parse(goodMust);
  }

  @Test
  public void testGoodWhen() throws ParserException {
    UnprocessedStatement unp = stmt("when", "2 > 4");
    unp.add(stmt("description", "this is my description"));
    unp.add(stmt("reference", "ref"));

    WhenStmt when = WhenStmt.parse(unp);
    assertEquals("2 > 4", when.getCondition());
    assertEquals("this is my description", when.getDescription());
    assertEquals("ref", when.getReference());
  }

  @Test
  public void testWhenUnknownStatement() throws ParserException {
    UnprocessedStatement unp = stmt("when", "2 > 4");
    unp.add(stmt("fake", "this is quite wrong"));
    exception.expect(ParserException.class);
    exception.expectMessage("unexpected substatements in 'when': fake");
    WhenStmt.parse(unp);
  }

  @Test
  public void testClosedDescription() throws ParserException {
    UnprocessedStatement unp = stmt("when", "2 > 4");
    UnprocessedStatement desc = stmt("description", "d");
    desc.add(stmt("reference", "r"));
    unp.add(desc);
    exception.expect(ParserException.class);
    WhenStmt.parse(unp);
  }

  @Test
  public void testGoodLeaf() throws ParserException {
    LeafStmt leaf = LeafStmt.parse(goodLeaf);
    assertEquals(1, leaf.getMusts().size());
    assertEquals("this is my error message",
                 leaf.getMusts().get(0).getErrorMessage());
    assertEquals(new Identifier("identifier"), leaf.getIdentifier());
    assertFalse(leaf.getConfig());
    assertNull(leaf.getMandatory());
    assertEquals(2, leaf.getIfFeatures().size());
    assertTrue(leaf.getIfFeatures().contains("3 > 4"));
    assertEquals(Status.OBSOLETE, leaf.getStatus());
    assertTrue(leaf.parseType() instanceof StringTypeStmt);
    // Type is left for a later pass
    assertEquals("string", leaf.getType().getArgument());
  }

  @Test
  public void testLeafDefaults() throws ParserException {
    UnprocessedStatement unp = stmt("leaf", "x");
    unp.add(stmt("type", "int8"));
    LeafStmt leaf = LeafStmt.parse(unp);
    assertEquals(Status.CURRENT, leaf.getStatus());
    assertNull(leaf.getConfig());
    assertNull(leaf.getWhen());
    assertNull(leaf.getDefault());
    assertTrue(leaf.getMusts().isEmpty());
  }

  @Test
  public void testLeafMissingType() throws ParserException {
    goodLeaf.takeOne("type");
    exception.expect(ParserException.class);
    exception.expectMessage("expected exactly one 'type' in 'leaf'");
    LeafStmt.parse(goodLeaf);
  }

  @Test
  public void testLeafBadStatus() throws ParserException {
    goodLeaf.takeOne("status");
    goodLeaf.add(stmt("status", "retired"));
    exception.expect(ParserException.class);
    exception.expectMessage("invalid status 'retired'");
    LeafStmt.parse(goodLeaf);
  }

  @Test
  public void testLeafBadBoolean() throws ParserException {
    goodLeaf.add(stmt("mandatory", "yes"));
    exception.expect(ParserException.class);
    exception.expectMessage("invalid boolean format: 'yes'");
    LeafStmt.parse(goodLeaf);
  }

  @Test
  public void testLeafDefaultAndMandatory() throws ParserException {
    goodLeaf.add(stmt("default", "x"));
    goodLeaf.add(stmt("mandatory", "true"));
    exception.expect(ParserException.class);
    LeafStmt.parse(goodLeaf);
  }

  @Test
  public void testGoodLeafList() throws ParserException {
    LeafListStmt leafList = LeafListStmt.parse(goodLeafList);
    assertEquals("leaflist", leafList.getIdentifier().content());
    assertNull(leafList.getConfig());
    assertEquals(Long.valueOf(34), leafList.getMinElements());
    assertEquals(Long.valueOf(53), leafList.getMaxElements());
    assertEquals(OrderedBy.SYSTEM, leafList.getOrderedBy());
    assertEquals(1, leafList.getMusts().size());
    assertTrue(leafList.getDefaults().isEmpty());
  }

  @Test
  public void testLeafListDefaults() throws ParserException {
    goodLeafList.takeOne("ordered-by");
    goodLeafList.takeOne("max-elements");
    goodLeafList.add(stmt("max-elements", "unbounded"));
    goodLeafList.add(stmt("default", "a"));
    goodLeafList.add(stmt("default", "b"));
    LeafListStmt leafList = LeafListStmt.parse(goodLeafList);
    assertEquals(OrderedBy.SYSTEM, leafList.getOrderedBy());
    assertNull(leafList.getMaxElements());
    assertEquals("b", leafList.getDefaults().get(1));
  }

  @Test
  public void testLeafListOrderedByUser() throws ParserException {
    goodLeafList.takeOne("ordered-by");
    goodLeafList.add(stmt("ordered-by", "user"));
    assertEquals(OrderedBy.USER,
                 LeafListStmt.parse(goodLeafList).getOrderedBy());
  }

  @Test
  public void testLeafListNegativeMinElements() throws ParserException {
    goodLeafList.takeOne("min-elements");
    goodLeafList.add(stmt("min-elements", "-1"));
    exception.expect(ParserException.class);
    LeafListStmt.parse(goodLeafList);
  }

  @Test
  public void testLeafListMinAboveMax() throws ParserException {
    goodLeafList.takeOne("min-elements");
    goodLeafList.add(stmt("min-elements", "54"));
    exception.expect(ParserException.class);
    LeafListStmt.parse(goodLeafList);
  }

  @Test
  public void testLeafListPrefixedType() throws ParserException {
    UnprocessedStatement type = goodLeafList.takeOne("type");
    goodLeafList.add(new UnprocessedStatement(type.getIdentifier(),
                                    "my-prefix", type.getArgument()));
    exception.expect(ParserException.class);
    LeafListStmt.parse(goodLeafList);
  }

  @Test
  public void testModule() throws ParserException {
    UnprocessedStatement unp = stmt("module", "example");
    for (String section: new String[] {"module-header", "linkage", "meta",
                                       "revision", "body"}) {
      unp.add(new UnprocessedStatement(new Identifier(section)));
    }
    ModuleStmt module = ModuleStmt.parse(unp);
    assertEquals("example", module.getIdentifier().content());
    assertEquals("linkage", module.getLinkage().getKey());
    assertTrue(unp.isEmpty());
  }

  @Test
  public void testModuleMissingSection() throws ParserException {
    UnprocessedStatement unp = stmt("module", "example");
    unp.add(new UnprocessedStatement(new Identifier("module-header")));
    exception.expect(ParserException.class);
    exception.expectMessage("'linkage'");
    ModuleStmt.parse(unp);
  }

  @Test
  public void testLeafEmptyName() throws UserException {
    UnprocessedStatement leaf = parseTree("leaf \"\" { type string; }");
    exception.expect(ParserException.class);
    exception.expectMessage("t.yang:1:1: empty argument for 'leaf'");
    LeafStmt.parse(leaf);
  }

  @Test
  public void testLeafListEmptyName() throws UserException {
    UnprocessedStatement leafList = parseTree("leaf-list '' { type int8; }");
    exception.expect(ParserException.class);
    exception.expectMessage("empty argument for 'leaf-list'");
    LeafListStmt.parse(leafList);
  }

  @Test
  public void testMustEmptyCondition() throws UserException {
    UnprocessedStatement must = parseTree("must \"\";");
    exception.expect(ParserException.class);
    exception.expectMessage("t.yang:1:1: empty argument for 'must'");
    MustStmt.parse(must);
  }

  @Test
  public void testWhenEmptyCondition() throws UserException {
    UnprocessedStatement when = parseTree("when '' { description d; }");
    exception.expect(ParserException.class);
    exception.expectMessage("empty argument for 'when'");
    WhenStmt.parse(when);
  }

  @Test
  public void testEmptyFreeText() throws UserException {
    LeafStmt leaf = LeafStmt.parse(parseTree(
        "leaf name {\n" +
        "  type string;\n" +
        "  units \"\";\n" +
        "  default '';\n" +
        "  description \"\";\n" +
        "  reference '';\n" +
        "  must \"name != ''\" { error-message \"\"; }\n" +
        "}"));
    assertEquals("", leaf.getUnits());
    assertEquals("", leaf.getDefault());
    assertEquals("", leaf.getDescription());
    assertEquals("", leaf.getReference());
    assertEquals("", leaf.getMusts().get(0).getErrorMessage());
  }

  @Test
  public void testIfFeatureEmpty() throws UserException {
    UnprocessedStatement leaf = parseTree(
        "leaf name { type string; if-feature \"\"; }");
    exception.expect(ParserException.class);
    exception.expectMessage("t.yang:1:26: empty argument for 'if-feature'");
    LeafStmt.parse(leaf);
  }

  @Test
  public void testConversions() throws ParserException {
    assertEquals(34, Conversions.convertInteger(null, "+34"));
    assertEquals(-3, Conversions.convertInteger(null, "-3"));
    assertTrue(Conversions.convertBoolean(null, "true"));
    assertEquals(Status.CURRENT, Conversions.convertStatus(null, null));
    assertEquals(Status.DEPRECATED,
                 Conversions.convertStatus(null, "deprecated"));
    assertEquals(OrderedBy.SYSTEM, Conversions.convertOrderedBy(null, null));

    exception.expect(ParserException.class);
    Conversions.convertOrderedBy(null, "random");
  }
}
