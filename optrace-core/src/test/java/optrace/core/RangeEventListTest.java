package optrace.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RangeEventListTest {
  @ParameterizedTest
  @ValueSource(ints = {0, 1, 3, 4, 5, 17})
  void growsByBlocks(int count) {
    RangeEventList list = new RangeEventList(4);
    for (int i = 0; i < count; i++) {
      list.append(Event.cpu(EventKind.MARK, "e" + i, 1, i));
    }
    assertEquals(count, list.size());
    assertEquals((count + 3) / 4, list.blockCount());
    List<Event> events = list.snapshot();
    assertEquals(count, events.size());
    for (int i = 0; i < count; i++) {
      assertEquals("e" + i, events.get(i).name());
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  void rejectsInvalidBlockSize(int blockSize) {
    assertThrows(IllegalArgumentException.class, () -> new RangeEventList(blockSize));
  }

  @Test
  void snapshotIsIndependentOfLaterAppends() {
    RangeEventList list = new RangeEventList(2);
    list.append(Event.cpu(EventKind.MARK, "a", 1, 0));
    List<Event> snapshot = list.snapshot();
    list.append(Event.cpu(EventKind.MARK, "b", 1, 1));
    assertEquals(1, snapshot.size());
    assertEquals(2, list.size());
  }

  @Test
  void clearDropsEveryBlock() {
    RangeEventList list = new RangeEventList(2);
    for (int i = 0; i < 5; i++) {
      list.append(Event.cpu(EventKind.MARK, "e" + i, 1, i));
    }
    List<Event> snapshot = list.snapshot();
    list.clear();
    assertEquals(0, list.size());
    assertEquals(0, list.blockCount());
    assertEquals(0, list.snapshot().size());
    assertEquals(5, snapshot.size());
    list.append(Event.cpu(EventKind.MARK, "again", 1, 5));
    assertEquals("again", list.snapshot().get(0).name());
  }
}
