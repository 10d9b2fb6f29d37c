package exm.yang.frontend.tree;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.Identifier;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class BitsTypeStmt extends TypeStmt {

  private final ImmutableList<BitStmt> bits;

  public BitsTypeStmt(List<BitStmt> bits) {
    this.bits = ImmutableList.copyOf(bits);
  }

  public List<BitStmt> getBits() {
    return bits;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.BITS.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.BITS;
  }

  public static BitsTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.BITS);
    List<BitStmt> bits = stmt.takeOneOrMore("bit", BitStmt.PARSER);
    stmt.ensureEmpty();

    Set<Identifier> names = new HashSet<Identifier>();
    for (BitStmt bit: bits) {
      if (!names.add(bit.getName())) {
        throw new ParserException(stmt.getPosition(),
                  "duplicate bit name '" + bit.getName() + "'");
      }
    }
    return new BitsTypeStmt(bits);
  }
}
