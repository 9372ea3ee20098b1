package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqliteDialect;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.exec.DatabaseException;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.FieldTypes;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.query.QueryType;
import io.intellixity.tessera.persistence.sequence.Sequence;
import io.intellixity.tessera.persistence.table.Schema;
import io.intellixity.tessera.persistence.table.TableType;
import io.intellixity.tessera.persistence.tx.ForwardingTransactionHooks;
import io.intellixity.tessera.persistence.tx.Transaction;
import io.intellixity.tessera.persistence.tx.TransactionHooks;
import io.intellixity.tessera.persistence.tx.TransactionType;
import io.intellixity.tessera.persistence.tx.TxStage;
import io.intellixity.tessera.persistence.tx.VerificationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TransactionSqliteIntegrationTest {
  private static final Dialect SQLITE = new SqliteDialect();
  private static final Schema ACCT = new Schema("acct");

  // ---- simple single-table transaction ----

  private static final TableType ABC = TableType.builder("abc")
      .fields(
          Field.of("a", FieldTypes.integer()).withContextKey("a"),
          Field.of("b", FieldTypes.text()),
          Field.of("c", FieldTypes.integer()))
      .primaryKey("a")
      .build();

  private static final TransactionType ABC_TX = TransactionType.builder("abc_tx")
      .contextField(Field.of("a", FieldTypes.integer()).withContextKey("a"))
      .record("row", ABC)
      .build();

  private static final TableType ABC_LINK = TableType.builder("abc_link")
      .fields(
          Field.of("a", FieldTypes.integer()).withContextKey("a"),
          Field.of("abc_a", FieldTypes.integer()))
      .primaryKey("a")
      .build();

  private static final TransactionType LINK_TX = TransactionType.builder("link_tx")
      .contextField(Field.of("a", FieldTypes.integer()).withContextKey("a"))
      .record("link", ABC_LINK)
      .build();

  // ---- journal entries ----

  private static final Sequence TRANS_SEQ = new Sequence("trans_id_seq").startingAt(101);

  private static final Field<BigDecimal> AMOUNT = Field.of("amount", FieldTypes.numeric(12, 2));

  private static final TableType JOURNALS = TableType.builder("journals")
      .schema(ACCT)
      .fields(
          Field.of("trans_id", FieldTypes.bigInt()).withContextKey("trans_id"),
          Field.of("kind", FieldTypes.text()).withContextKey("kind"),
          Field.of("description", FieldTypes.text()),
          Field.of("booked_at", FieldTypes.timestampTz()))
      .primaryKey("trans_id")
      .build();

  private static final TableType POSTINGS = TableType.builder("postings")
      .schema(ACCT)
      .fields(
          Field.of("trans_id", FieldTypes.bigInt()).withContextKey("trans_id"),
          Field.of("line", FieldTypes.integer()).rowEnumerated("line_no"),
          Field.of("account", FieldTypes.text()),
          AMOUNT)
      .primaryKey("trans_id", "line")
      .foreignKey(List.of("trans_id"), "journals", List.of("trans_id"))
      .build();

  private static final QueryType LINES = QueryType.builder("entry_lines")
      .text("SELECT account, amount FROM {acct.postings} WHERE trans_id = {trans_id} ORDER BY line")
      .resultType(RecordType.recordBuilder("entry_line")
          .fields(Field.of("account", FieldTypes.text()), Field.of("amount", FieldTypes.numeric(12, 2)))
          .build())
      .parameter(Field.of("trans_id", FieldTypes.bigInt()).withContextKey("trans_id"))
      .build();

  private static final TransactionHooks BALANCED = new TransactionHooks() {
    @Override
    public boolean verify(Transaction tx, Context context) {
      BigDecimal sum = BigDecimal.ZERO;
      for (BigDecimal a : tx.recordList("postings").column(AMOUNT)) sum = sum.add(a);
      return sum.signum() == 0;
    }
  };

  private static final TransactionType ENTRY = TransactionType.builder("journal_entry")
      .contextField(Field.of("trans_id", FieldTypes.bigInt()).withContextKey("trans_id").generatedBy(TRANS_SEQ))
      .contextField(Field.of("journal_kind", FieldTypes.text()).withContextKey("kind"))
      .record("journal", JOURNALS)
      .recordList("postings", POSTINGS)
      .queryResult("lines", LINES)
      .hooks(BALANCED)
      .build();

  private static final TransactionType SALE = TransactionType.builder("sale_entry")
      .extending(ENTRY)
      .hooks(new ForwardingTransactionHooks(BALANCED) {
        @Override
        public void preInsert(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
          super.preInsert(tx, context, cursor, dialect);
          tx.record("journal").set("kind", "sale");
        }
      })
      .build();

  private Connection conn;
  private JdbcCursor cursor;

  @BeforeEach
  void open() throws SQLException {
    conn = DriverManager.getConnection("jdbc:sqlite::memory:");
    cursor = new JdbcCursor("sqlite", conn);
    SqliteTables.create(cursor, SQLITE, ABC);
    SqliteTables.create(cursor, SQLITE, JOURNALS);
    SqliteTables.create(cursor, SQLITE, POSTINGS);
    TRANS_SEQ.create(cursor, SQLITE);
  }

  @AfterEach
  void close() throws SQLException {
    conn.close();
  }

  private static Transaction entry(TransactionType type, String description, String... accountsAndAmounts) {
    Transaction tx = type.newTransaction();
    tx.setRecord("journal", JOURNALS.newRecord(Map.of(
        "description", description,
        "booked_at", Instant.parse("2024-01-02T03:04:05Z"))));
    for (int i = 0; i < accountsAndAmounts.length; i += 2) {
      tx.recordList("postings").add(POSTINGS.newRecord(Map.of(
          "account", accountsAndAmounts[i], "amount", accountsAndAmounts[i + 1])));
    }
    return tx;
  }

  @Test
  void singleRecordRoundTrip() {
    Transaction tx = ABC_TX.newTransaction().set("a", 1).setRecord("row", ABC.newRecord(Map.of("b", "x", "c", 2)));
    tx.insertExisting(cursor);

    Transaction read = ABC_TX.newTransaction().set("a", 1);
    read.contextSelect(cursor);
    assertEquals(ABC.newRecord(1, "x", 2), read.record("row"));
  }

  @Test
  void insertNewAllocatesFromTheSequence() {
    Context first = entry(ENTRY, "Opening", "cash", "100.00", "equity", "-100.00").insertNew(cursor);
    Context second = entry(ENTRY, "Second", "cash", "5", "sales", "-5").insertNew(cursor);

    assertEquals(new Context().put("trans_id", 101L).put("kind", null), first);
    assertEquals(102L, second.get("trans_id"));
    assertEquals(2, SqliteTables.count(cursor, SQLITE, JOURNALS));
    assertEquals(4, SqliteTables.count(cursor, SQLITE, POSTINGS));
  }

  @Test
  void contextSelectReadsEverythingBack() {
    entry(SALE, "Invoice", "receivable", "42.50", "sales", "-42.50").insertNew(cursor);

    Transaction tx = ENTRY.newTransaction().set("trans_id", 101L);
    Context ctx = tx.contextSelect(cursor);

    Record journal = tx.record("journal");
    assertEquals("Invoice", journal.get("description"));
    assertEquals(Instant.parse("2024-01-02T03:04:05Z"), journal.get("booked_at"));
    assertEquals("sale", ctx.get("kind"));
    assertEquals("sale", tx.get("journal_kind"));

    assertEquals(2, tx.recordList("postings").size());
    Record first = tx.recordList("postings").get(0);
    assertEquals(1, first.get("line"));
    assertEquals(new BigDecimal("42.50"), first.get(AMOUNT));

    assertEquals(2, tx.queryResult("lines").size());
    assertEquals("sales", tx.queryResult("lines").get(1).get("account"));
    assertEquals(TxStage.COMMITTED, tx.stage());
  }

  @Test
  void unbalancedEntriesAreRolledBack() {
    Transaction tx = entry(ENTRY, "Broken", "cash", "10", "sales", "-9");

    assertThrows(VerificationException.class, () -> tx.insertNew(cursor));
    assertEquals(TxStage.ABORTED, tx.stage());
    assertEquals(0, SqliteTables.count(cursor, SQLITE, JOURNALS));
    assertEquals(0, SqliteTables.count(cursor, SQLITE, POSTINGS));

    // generated context values are not handed back
    assertEquals(102L, entry(ENTRY, "Fixed", "cash", "10", "sales", "-10").insertNew(cursor).get("trans_id"));
  }

  @Test
  void failedStatementsRollBackEarlierOnes() {
    cursor.execute("INSERT INTO \"acct_postings\" (\"trans_id\", \"line\", \"account\", \"amount\") VALUES (?, ?, ?, ?)",
        List.of(200L, 2, "stray", "0"));

    Transaction tx = entry(ENTRY, "Clash", "cash", "2", "equity", "-2").set("trans_id", 200L);

    assertThrows(DatabaseException.class, () -> tx.insertExisting(cursor));
    assertEquals(TxStage.ABORTED, tx.stage());
    assertEquals(0, SqliteTables.count(cursor, SQLITE, JOURNALS));
    assertEquals(1, SqliteTables.count(cursor, SQLITE, POSTINGS));
  }

  @Test
  void failedCommitIsRolledBack() throws SQLException {
    cursor.execute("PRAGMA foreign_keys = ON", List.of());
    cursor.execute("CREATE TABLE \"abc_link\" (\"a\" INTEGER NOT NULL PRIMARY KEY, "
        + "\"abc_a\" INTEGER REFERENCES \"abc\" (\"a\") DEFERRABLE INITIALLY DEFERRED)", List.of());

    Transaction tx = LINK_TX.newTransaction().set("a", 5).setRecord("link", ABC_LINK.newRecord(Map.of("abc_a", 99)));

    DatabaseException e = assertThrows(DatabaseException.class, () -> tx.insertExisting(cursor));
    assertTrue(e.getMessage().startsWith("Commit failed"), e.getMessage());
    assertEquals(0, e.getSuppressed().length);
    assertEquals(TxStage.ABORTED, tx.stage());
    assertEquals(0, SqliteTables.count(cursor, SQLITE, ABC_LINK));
    assertTrue(conn.getAutoCommit());

    // the connection is usable afterwards
    ABC_TX.newTransaction().set("a", 99).setRecord("row", ABC.newRecord(Map.of("b", "x", "c", 1))).insertExisting(cursor);
    tx.insertExisting(cursor);
    assertEquals(1, SqliteTables.count(cursor, SQLITE, ABC_LINK));
  }

  @Test
  void updateAndDeleteWorkByPrimaryKey() {
    entry(ENTRY, "Opening", "cash", "10", "equity", "-10").insertNew(cursor);

    Transaction tx = ENTRY.newTransaction().set("trans_id", 101L);
    tx.contextSelect(cursor);
    tx.record("journal").set("description", "Corrected");
    tx.recordList("postings").get(0).set(AMOUNT, new BigDecimal("25"));
    tx.recordList("postings").get(1).set(AMOUNT, new BigDecimal("-25"));
    tx.update(cursor);

    Transaction reread = ENTRY.newTransaction().set("trans_id", 101L);
    reread.contextSelect(cursor);
    assertEquals("Corrected", reread.record("journal").get("description"));
    assertEquals(new BigDecimal("-25.00"), reread.recordList("postings").get(1).get(AMOUNT));

    reread.delete(cursor);
    assertEquals(0, SqliteTables.count(cursor, SQLITE, JOURNALS));
    assertEquals(0, SqliteTables.count(cursor, SQLITE, POSTINGS));
  }

  @Test
  void sequenceResetStartsOver() {
    assertEquals(101L, TRANS_SEQ.nextValue(cursor, SQLITE));
    assertEquals(102L, TRANS_SEQ.nextValue(cursor, SQLITE));
    TRANS_SEQ.reset(cursor, SQLITE);
    assertEquals(101L, TRANS_SEQ.nextValue(cursor, SQLITE));
  }
}
