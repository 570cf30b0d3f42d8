package com.example.servicerota.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 直近のエラーを新しい順に保持するバッファ
 */
@Component
public class ErrorLogBuffer {
    private static final int MAX_ENTRIES = 200;

    private final Deque<Entry> deque = new ConcurrentLinkedDeque<>();

    public void addError(String message, Throwable t) {
        String m = message == null ? "" : message;
        String detail = t == null ? "" : (t.getClass().getName() + ": " + t.getMessage());
        deque.addFirst(new Entry(LocalDateTime.now(), m, detail));
        while (deque.size() > MAX_ENTRIES) deque.removeLast();
    }

    public List<Entry> recent() {
        return new ArrayList<>(deque);
    }

    public void clear() {
        deque.clear();
    }

    public record Entry(LocalDateTime time, String message, String detail) {}
}
