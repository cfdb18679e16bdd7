package com.phillippitts.interviewengine.testutil;

import com.phillippitts.interviewengine.domain.ConversationMessage;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.TextGenerator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * Test double for TextGenerator returning scripted responses.
 *
 * <p>Records every call (history and instruction). Optional modes:
 * <ul>
 *   <li>{@code shouldFail}: every call throws a CapabilityException</li>
 *   <li>{@link #blockUntilInterrupted()}: calls park until the worker thread is interrupted,
 *       counting down {@link #entered} first, for cancellation tests</li>
 * </ul>
 */
public class ScriptedTextGenerator implements TextGenerator {
    private final Deque<String> script = new ArrayDeque<>();
    public String cannedResponse;
    public boolean healthy = true;
    public volatile boolean shouldFail;
    private volatile boolean block;
    public final CountDownLatch entered = new CountDownLatch(1);
    public final List<Call> calls = new CopyOnWriteArrayList<>();

    public ScriptedTextGenerator(String cannedResponse) {
        this.cannedResponse = cannedResponse;
    }

    public ScriptedTextGenerator then(String response) {
        synchronized (script) {
            script.addLast(response);
        }
        return this;
    }

    public ScriptedTextGenerator blockUntilInterrupted() {
        this.block = true;
        return this;
    }

    @Override
    public String generate(List<ConversationMessage> history, String systemInstruction) {
        calls.add(new Call(List.copyOf(history), systemInstruction));
        if (block) {
            entered.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CapabilityException("Generation interrupted", Capability.LLM, "interrupted", e);
            }
        }
        if (shouldFail) {
            throw new CapabilityException("Generator configured to fail", Capability.LLM);
        }
        synchronized (script) {
            return script.isEmpty() ? cannedResponse : script.pollFirst();
        }
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    /**
     * One recorded generate() invocation.
     */
    public record Call(List<ConversationMessage> history, String instruction) {}
}
