package com.docsort.support;

import com.docsort.model.ImageVariant;
import com.docsort.recognition.RecognitionEngine;
import com.docsort.recognition.RecognitionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recognition engine that replays a script of texts and failures, one per
 * call, and records every variant it was given. Once the script runs out it
 * returns empty text.
 */
public class ScriptedRecognitionEngine implements RecognitionEngine {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<ImageVariant> calls = new ArrayList<>();

    public static ScriptedRecognitionEngine returning(String... texts) {
        ScriptedRecognitionEngine engine = new ScriptedRecognitionEngine();
        for (String t : texts) engine.thenReturn(t);
        return engine;
    }

    public ScriptedRecognitionEngine thenReturn(String text) {
        script.add(text);
        return this;
    }

    public ScriptedRecognitionEngine thenFail(Exception failure) {
        script.add(failure);
        return this;
    }

    @Override
    public String recognize(ImageVariant variant) throws RecognitionException {
        calls.add(variant);
        Object next = script.poll();
        if (next == null) return "";
        if (next instanceof RecognitionException re) throw re;
        if (next instanceof RuntimeException rte) throw rte;
        return (String) next;
    }

    public List<ImageVariant> calls() {
        return calls;
    }

    public int callCount() {
        return calls.size();
    }
}
