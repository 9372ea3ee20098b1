package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqliteDialect;
import io.intellixity.tessera.persistence.exec.IsolationLevel;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.query.QueryType;

import java.util.*;

/**
 * Definition of a transaction: its own context fields and its members, both in declaration order,\n
 * plus the hooks, isolation level and default dialect its operations use.\n
 *
 * Declaration order is execution order: context fields resolve first to last, members are written\n
 * first to last (deleted last to first).\n
 */
public final class TransactionType {
  private final String name;
  private final List<Field<?>> contextFields;
  private final List<Member> members;
  private final Map<String, Integer> fieldIndex;
  private final Map<String, Member> memberIndex;
  private final TransactionHooks hooks;
  private final IsolationLevel isolationLevel;
  private final TransactionOrchestrator orchestrator;

  private TransactionType(Builder b) {
    this.name = b.name;
    this.contextFields = List.copyOf(b.contextFields);
    this.members = List.copyOf(b.members);
    this.hooks = b.hooks;
    this.isolationLevel = b.isolationLevel;
    this.orchestrator = new TransactionOrchestrator(b.dialect);

    Map<String, Integer> fi = new HashMap<>();
    Set<String> contextKeys = new HashSet<>();
    for (int i = 0; i < contextFields.size(); i++) {
      Field<?> f = contextFields.get(i);
      fi.put(f.name(), i);
      if (!contextKeys.add(f.contextName())) {
        throw new IllegalArgumentException("Context key '" + f.contextName() + "' is declared twice in transaction '" + name + "'");
      }
    }
    Map<String, Member> mi = new LinkedHashMap<>();
    for (Member m : members) mi.put(m.name(), m);
    this.fieldIndex = Map.copyOf(fi);
    this.memberIndex = Collections.unmodifiableMap(mi);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() { return name; }
  public List<Field<?>> contextFields() { return contextFields; }
  public List<Member> members() { return members; }
  public TransactionHooks hooks() { return hooks; }
  public IsolationLevel isolationLevel() { return isolationLevel; }
  public TransactionOrchestrator orchestrator() { return orchestrator; }
  public Dialect defaultDialect() { return orchestrator.defaultDialect(); }

  /** Index of a context field, or -1. */
  public int indexOfField(String fieldName) {
    Integer i = fieldIndex.get(fieldName);
    return i == null ? -1 : i;
  }

  /** Member by name, or null. */
  public Member member(String memberName) {
    return memberIndex.get(memberName);
  }

  public Transaction newTransaction() {
    return new Transaction(this);
  }

  @Override
  public String toString() {
    return "TransactionType(" + name + ")";
  }

  public static final class Builder {
    private final String name;
    private final List<Field<?>> contextFields = new ArrayList<>();
    private final List<Member> members = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private TransactionHooks hooks = TransactionHooks.DEFAULT;
    private IsolationLevel isolationLevel = IsolationLevel.DEFAULT;
    private Dialect dialect;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    /** Starts from everything {@code parent} declares; later calls add to or replace it. */
    public Builder extending(TransactionType parent) {
      Objects.requireNonNull(parent, "parent");
      for (Field<?> f : parent.contextFields()) contextField(f);
      for (Member m : parent.members()) member(m);
      this.hooks = parent.hooks();
      this.isolationLevel = parent.isolationLevel();
      this.dialect = parent.defaultDialect();
      return this;
    }

    public Builder contextField(Field<?> field) {
      Objects.requireNonNull(field, "field");
      claim(field.name());
      contextFields.add(field);
      return this;
    }

    public Builder contextFields(Field<?>... fs) {
      for (Field<?> f : fs) contextField(f);
      return this;
    }

    public Builder record(String memberName, RecordType type) {
      return member(Member.record(memberName, type));
    }

    public Builder recordList(String memberName, RecordType type) {
      return member(Member.recordList(memberName, type));
    }

    public Builder queryResult(String memberName, QueryType type) {
      return member(Member.queryResult(memberName, type));
    }

    public Builder member(Member m) {
      Objects.requireNonNull(m, "member");
      claim(m.name());
      members.add(m);
      return this;
    }

    public Builder hooks(TransactionHooks h) {
      this.hooks = Objects.requireNonNull(h, "hooks");
      return this;
    }

    public Builder isolationLevel(IsolationLevel level) {
      this.isolationLevel = Objects.requireNonNull(level, "isolationLevel");
      return this;
    }

    /** Dialect used when an operation is called without one; SQLite when never set. */
    public Builder dialect(Dialect d) {
      this.dialect = Objects.requireNonNull(d, "dialect");
      return this;
    }

    private void claim(String attributeName) {
      if (!names.add(attributeName)) {
        throw new IllegalArgumentException("Attribute '" + attributeName + "' is declared twice in transaction '" + name + "'");
      }
    }

    public TransactionType build() {
      if (dialect == null) dialect = new SqliteDialect();
      return new TransactionType(this);
    }
  }
}
