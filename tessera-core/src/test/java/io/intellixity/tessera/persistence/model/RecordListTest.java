package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.FieldTypes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RecordListTest {
  private static final Field<String> ACCOUNT = Field.of("account", FieldTypes.text());
  private static final Field<Integer> AMOUNT = Field.of("amount", FieldTypes.integer());
  private static final RecordType POSTING = RecordType.recordBuilder("posting").fields(ACCOUNT, AMOUNT).build();
  private static final RecordType OTHER = RecordType.recordBuilder("other").fields(ACCOUNT).build();

  @Test
  void onlyHoldsItsOwnRecordType() {
    RecordList list = POSTING.newList();
    list.add(POSTING.newRecord("cash", 10));
    assertThrows(SchemaViolationException.class, () -> list.add(OTHER.newRecord("x")));
    assertThrows(NullPointerException.class, () -> list.add(null));
    assertEquals(1, list.size());
  }

  @Test
  void columnIsALiveProjection() {
    RecordList list = POSTING.newList();
    list.add(POSTING.newRecord("cash", 10));
    Iterable<Integer> amounts = list.column(AMOUNT);
    list.add(POSTING.newRecord("sales", -10));

    List<Integer> seen = new ArrayList<>();
    amounts.forEach(seen::add);
    assertEquals(List.of(10, -10), seen);

    int sum = 0;
    for (Integer a : amounts) sum += a;
    assertEquals(0, sum);
  }

  @Test
  void reversedWalksBackwards() {
    RecordList list = new RecordList(POSTING, List.of(POSTING.newRecord("a", 1), POSTING.newRecord("b", 2)));
    List<Object> accounts = new ArrayList<>();
    for (Record r : list.reversed()) accounts.add(r.get("account"));
    assertEquals(List.of("b", "a"), accounts);
  }

  @Test
  void copyIsDeep() {
    RecordList list = POSTING.newList().add(POSTING.newRecord("cash", 10));
    RecordList copy = list.copy();
    assertEquals(list, copy);
    copy.get(0).set(AMOUNT, 11);
    assertEquals(10, list.get(0).get(AMOUNT));
  }

  @Test
  void asListIsReadOnly() {
    RecordList list = POSTING.newList().add(POSTING.newRecord("cash", 10));
    assertThrows(UnsupportedOperationException.class, () -> list.asList().clear());
    list.remove(0);
    assertTrue(list.isEmpty());
  }
}
