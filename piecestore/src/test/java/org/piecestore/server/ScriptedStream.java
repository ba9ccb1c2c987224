package org.piecestore.server;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * In-memory stream replaying a fixed script of peer messages and recording
 * everything sent back. The peer ends the stream once the script runs out.
 */
class ScriptedStream<I, O> implements MessageStream<I, O> {
    
    private final Deque<I> script;
    private final List<O> sent = new ArrayList<>();
    
    @SafeVarargs
    ScriptedStream(I... messages) {
        this.script = new ArrayDeque<>(Arrays.asList(messages));
    }
    
    ScriptedStream(List<I> messages) {
        this.script = new ArrayDeque<>(messages);
    }
    
    @Override
    public I receive() {
        return script.pollFirst();
    }
    
    @Override
    public void send(O message) {
        sent.add(message);
    }
    
    List<O> getSent() {
        return sent;
    }
    
    int remaining() {
        return script.size();
    }
}
