package io.intellixity.tessera.persistence.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.SqlKind;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordList;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.table.RelationType;
import io.intellixity.tessera.persistence.tx.Member;
import io.intellixity.tessera.persistence.tx.Transaction;
import io.intellixity.tessera.persistence.tx.TransactionType;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * JSON codec for records, record lists and transactions.\n
 *
 * Encoded objects carry a type marker ({@code __record__}, {@code __record_list__}, {@code __transaction__})\n
 * naming their type, plus {@code __schema__} for relations that live in a schema. Decimals are written as\n
 * strings, temporal values and UUIDs as ISO strings, enums by name and blobs as base64.\n
 *
 * Decoding only knows the types registered with this instance and rebuilds values through the\n
 * validated setters. Query results are not encoded; they are re-read from the database.\n
 */
public final class TesseraJson {
  public static final String RECORD = "__record__";
  public static final String RECORD_LIST = "__record_list__";
  public static final String TRANSACTION = "__transaction__";
  public static final String SCHEMA = "__schema__";
  public static final String VALUES = "values";

  private final ObjectMapper mapper;
  private final Map<String, RecordType> recordTypes = new HashMap<>();
  private final Map<String, TransactionType> transactionTypes = new HashMap<>();

  public TesseraJson() {
    this(new ObjectMapper());
  }

  public TesseraJson(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public TesseraJson register(RecordType type) {
    Objects.requireNonNull(type, "type");
    recordTypes.put(type.name(), type);
    return this;
  }

  /** Registers the transaction type and the record types of its members. */
  public TesseraJson register(TransactionType type) {
    Objects.requireNonNull(type, "type");
    transactionTypes.put(type.name(), type);
    for (Member m : type.members()) {
      if (m.kind() != Member.Kind.QUERY_RESULT) recordTypes.putIfAbsent(m.recordType().name(), m.recordType());
    }
    return this;
  }

  // ---- encoding ----

  public String write(Record r) {
    return stringify(recordNode(r, true));
  }

  public String write(RecordList list) {
    return stringify(listNode(list));
  }

  public String write(Transaction tx) {
    return stringify(transactionNode(tx));
  }

  public ObjectNode recordNode(Record r, boolean withMarker) {
    ObjectNode n = mapper.createObjectNode();
    if (withMarker) {
      n.put(RECORD, r.type().name());
      putSchema(n, r.type());
    }
    List<Field<?>> fields = r.type().fields();
    List<Object> values = r.values();
    for (int i = 0; i < fields.size(); i++) n.set(fields.get(i).name(), valueNode(values.get(i)));
    return n;
  }

  public ObjectNode listNode(RecordList list) {
    ObjectNode n = mapper.createObjectNode();
    n.put(RECORD_LIST, list.recordType().name());
    putSchema(n, list.recordType());
    ArrayNode values = n.putArray(VALUES);
    for (Record r : list) values.add(recordNode(r, false));
    return n;
  }

  public ObjectNode transactionNode(Transaction tx) {
    ObjectNode n = mapper.createObjectNode();
    n.put(TRANSACTION, tx.type().name());
    for (Field<?> f : tx.type().contextFields()) n.set(f.name(), valueNode(tx.get(f.name())));
    for (Member m : tx.type().members()) {
      switch (m.kind()) {
        case RECORD -> {
          Record r = tx.record(m.name());
          n.set(m.name(), r == null ? n.nullNode() : recordNode(r, true));
        }
        case RECORD_LIST -> n.set(m.name(), listNode(tx.recordList(m.name())));
        case QUERY_RESULT -> { }
      }
    }
    return n;
  }

  private JsonNode valueNode(Object v) {
    if (v == null) return mapper.nullNode();
    if (v instanceof BigDecimal bd) return mapper.getNodeFactory().textNode(bd.toPlainString());
    if (v instanceof TemporalAccessor || v instanceof UUID) return mapper.getNodeFactory().textNode(v.toString());
    if (v instanceof Enum<?> e) return mapper.getNodeFactory().textNode(e.name());
    return mapper.valueToTree(v);
  }

  private static void putSchema(ObjectNode n, RecordType type) {
    if (type instanceof RelationType rel && rel.schemaName() != null) n.put(SCHEMA, rel.schemaName());
  }

  private String stringify(JsonNode n) {
    try {
      return mapper.writeValueAsString(n);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to write JSON", e);
    }
  }

  // ---- decoding ----

  /**
   * Parses JSON text. Objects with a marker become {@link Record}, {@link RecordList} or {@link Transaction};\n
   * anything else is returned as plain maps, lists and scalars.\n
   */
  public Object read(String json) {
    Objects.requireNonNull(json, "json");
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON", e);
    }
    if (root.isObject()) {
      if (root.has(TRANSACTION)) return readTransaction(root);
      if (root.has(RECORD_LIST)) return readList(root);
      if (root.has(RECORD)) return readRecord(root, recordType(root, RECORD));
    }
    return plain(root);
  }

  public Record readRecord(String json) {
    return expect(read(json), Record.class);
  }

  public RecordList readRecordList(String json) {
    return expect(read(json), RecordList.class);
  }

  public Transaction readTransaction(String json) {
    return expect(read(json), Transaction.class);
  }

  private Transaction readTransaction(JsonNode n) {
    String name = n.get(TRANSACTION).asText();
    TransactionType type = transactionTypes.get(name);
    if (type == null) throw new IllegalArgumentException("Transaction type '" + name + "' is not registered");

    Transaction tx = type.newTransaction();
    for (Field<?> f : type.contextFields()) {
      JsonNode v = n.get(f.name());
      if (v != null) tx.set(f.name(), fieldValue(f, v));
    }
    for (Member m : type.members()) {
      JsonNode v = n.get(m.name());
      if (v == null || v.isNull()) continue;
      switch (m.kind()) {
        case RECORD -> tx.setRecord(m.name(), readRecord(v, m.recordType()));
        case RECORD_LIST -> tx.setRecordList(m.name(), readList(v));
        case QUERY_RESULT -> { }
      }
    }
    return tx;
  }

  private RecordList readList(JsonNode n) {
    RecordType type = recordType(n, RECORD_LIST);
    RecordList list = new RecordList(type);
    JsonNode values = n.get(VALUES);
    if (values != null && values.isArray()) {
      for (JsonNode v : values) list.add(readRecord(v, type));
    }
    return list;
  }

  private Record readRecord(JsonNode n, RecordType type) {
    if (!n.isObject()) throw new IllegalArgumentException("Record '" + type.name() + "' must be a JSON object");
    Record r = type.newRecord();
    for (Field<?> f : type.fields()) {
      JsonNode v = n.get(f.name());
      if (v != null) r.set(f.name(), fieldValue(f, v));
    }
    return r;
  }

  private RecordType recordType(JsonNode n, String marker) {
    String name = n.get(marker).asText();
    RecordType type = recordTypes.get(name);
    if (type == null) throw new IllegalArgumentException("Record type '" + name + "' is not registered");
    JsonNode schema = n.get(SCHEMA);
    if (schema != null && !schema.isNull()) {
      String expected = type instanceof RelationType rel ? rel.schemaName() : null;
      if (!schema.asText().equals(expected)) {
        throw new IllegalArgumentException("Record type '" + name + "' is registered in schema '" + expected
            + "', not '" + schema.asText() + "'");
      }
    }
    return type;
  }

  /** Raw value for {@link Field#validate}: the field type does the parsing of strings. */
  private Object fieldValue(Field<?> f, JsonNode v) {
    if (v.isNull()) return null;
    if (f.type().kind() == SqlKind.BLOB && v.isTextual()) {
      try {
        return v.binaryValue();
      } catch (IOException e) {
        throw new IllegalArgumentException("Field '" + f.name() + "' is not valid base64", e);
      }
    }
    return plain(v);
  }

  private Object plain(JsonNode v) {
    if (v.isTextual()) return v.asText();
    if (v.isIntegralNumber()) return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
    if (v.isNumber()) return v.isBigDecimal() ? v.decimalValue() : v.doubleValue();
    try {
      return mapper.treeToValue(v, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unsupported JSON value: " + v, e);
    }
  }

  private static <T> T expect(Object decoded, Class<T> type) {
    if (!type.isInstance(decoded)) {
      throw new IllegalArgumentException("JSON does not encode a " + type.getSimpleName());
    }
    return type.cast(decoded);
  }
}
