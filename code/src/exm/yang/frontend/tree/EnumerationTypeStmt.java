package exm.yang.frontend.tree;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class EnumerationTypeStmt extends TypeStmt {

  private final ImmutableList<EnumStmt> enums;

  public EnumerationTypeStmt(List<EnumStmt> enums) {
    this.enums = ImmutableList.copyOf(enums);
  }

  public List<EnumStmt> getEnums() {
    return enums;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.ENUMERATION.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.ENUMERATION;
  }

  public static EnumerationTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.ENUMERATION);
    List<EnumStmt> enums = stmt.takeOneOrMore("enum", EnumStmt.PARSER);
    stmt.ensureEmpty();

    Set<String> names = new HashSet<String>();
    Set<Integer> values = new HashSet<Integer>();
    for (EnumStmt e: enums) {
      if (!names.add(e.getName())) {
        throw new ParserException(stmt.getPosition(),
                  "duplicate enum name '" + e.getName() + "'");
      }
      if (e.getValue() != null && !values.add(e.getValue())) {
        throw new ParserException(stmt.getPosition(),
                  "duplicate enum value " + e.getValue());
      }
    }
    return new EnumerationTypeStmt(enums);
  }
}
