package com.example.qrattendance.controller;

import com.example.qrattendance.service.AttendanceSseNotifier;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class QrAttendanceSseRateLimitTest {

    private final QrAttendanceSseController controller =
        new QrAttendanceSseController(mock(AttendanceSseNotifier.class));

    private void connectFrom(String ip) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(ip);
        controller.streamAttendance("C1", LocalDate.of(2025, 1, 20), request);
    }

    @Test
    void testWindowIsKeptWhileActive() {
        // given
        connectFrom("198.51.100.1");
        connectFrom("198.51.100.1");

        // when
        controller.evictStaleWindows(System.currentTimeMillis());

        // then
        assertEquals(1, controller.trackedClientCount());
    }

    @Test
    void testStaleWindowsAreEvicted() {
        // given: many one-off clients
        for (int i = 0; i < 50; i++) {
            connectFrom("198.51.100." + i);
        }
        assertEquals(50, controller.trackedClientCount());

        // when
        controller.evictStaleWindows(System.currentTimeMillis() + QrAttendanceSseController.RATE_LIMIT_WINDOW_MS + 1);

        // then
        assertEquals(0, controller.trackedClientCount());
    }

    @Test
    void testEvictedClientStartsFreshWindow() {
        // given: a client at its limit
        for (int i = 0; i < QrAttendanceSseController.MAX_CONNECTIONS_PER_IP; i++) {
            connectFrom("198.51.100.9");
        }

        // when
        controller.evictStaleWindows(System.currentTimeMillis() + QrAttendanceSseController.RATE_LIMIT_WINDOW_MS + 1);
        connectFrom("198.51.100.9");

        // then
        assertEquals(1, controller.trackedClientCount());
    }
}
