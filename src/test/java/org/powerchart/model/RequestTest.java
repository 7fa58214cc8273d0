package org.powerchart.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 5, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 25, 0, 0);

    @Test
    void mainRoomDefaultsToWholeView() {
        Request request = new Request(ChannelCatalog.MAIN_ROOM, null, START, END, 50, MetricMode.BOTH, false, null);

        assertEquals(MainRoomView.WHOLE, request.view());
        assertTrue(request.needsUps());
        assertTrue(request.needsAnnex());
        assertTrue(request.needsEnterprise());
        assertEquals("Power Data for Com Center Main Room Total", request.title());
        assertEquals(20, request.numDays());
        assertTrue(request.outputFile().isEmpty());
    }

    @Test
    void otherGroupsNeedOnlyHpc() {
        Request request = new Request("PDU-A4-1", MainRoomView.NONMETERED, START, END, 50, MetricMode.AVERAGE, true, null);

        assertFalse(request.needsUps());
        assertFalse(request.needsEnterprise());
        assertEquals("Power Data for PDU-A4-1", request.title());
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new Request("PDU-A4-1", null, START, END, 0, MetricMode.BOTH, false, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Request("PDU-A4-1", null, END, START, 10, MetricMode.BOTH, false, null));
    }
}
