package game.impl;

import static org.junit.jupiter.api.Assertions.*;

import game.records.GameResult;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HeaderTest {

  @Test
  void unknownMarkersClearFields() {
    Header h = new Header();
    assertTrue(h.parse("Event", "?"));
    assertTrue(h.parse("Site", "??"));
    assertTrue(h.parse("Date", "????.??.??"));
    assertTrue(h.parse("White", "  "));
    assertTrue(h.event().isEmpty());
    assertTrue(h.site().isEmpty());
    assertTrue(h.date().isEmpty());
    assertTrue(h.white().isEmpty());
  }

  @Test
  void partialDatesAreKept() {
    Header h = new Header();
    h.setDate("2023.??.??");
    assertEquals(Optional.of("2023.??.??"), h.date());
  }

  @Test
  void onlyRosterKeysAreParsed() {
    Header h = new Header();
    assertTrue(h.parse("Black", "Carlsen, M"));
    assertTrue(h.parse("Result", "0-1"));
    assertFalse(h.parse("ECO", "B90"));
    assertFalse(h.parse("event", "lower case is another tag"));
    assertEquals(Optional.of("Carlsen, M"), h.black());
    assertEquals(GameResult.BLACK_WON, h.result());
  }

  @Test
  void tagsAreInRosterOrderWithMarkers() {
    Header h = new Header();
    h.setRound("4.1");
    assertEquals(List.of("Event", "Site", "Date", "Round", "White", "Black", "Result"),
            List.copyOf(h.tags().keySet()));
    assertEquals(List.of("?", "?", "????.??.??", "4.1", "?", "?", "*"), List.copyOf(h.tags().values()));
  }
}
