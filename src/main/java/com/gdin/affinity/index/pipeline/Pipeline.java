package com.gdin.affinity.index.pipeline;

import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

public class Pipeline<C> implements Iterable<Pipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        WorkflowFunction<C> fn;
    }

    @Getter
    private final String name;

    private final List<Step<C>> steps = new ArrayList<>();

    public Pipeline(String name) {
        this.name = name;
    }

    public Pipeline<C> add(String stepName, WorkflowFunction<C> fn) {
        steps.add(new Step<>(stepName, fn));
        return this;
    }

    public List<String> stepNames() {
        return steps.stream().map(Step::getName).collect(Collectors.toList());
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return steps.iterator();
    }
}
