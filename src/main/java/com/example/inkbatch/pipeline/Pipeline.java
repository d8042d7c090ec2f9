package com.example.inkbatch.pipeline;

import com.example.inkbatch.error.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered sequence of steps; each step's output is the next step's input.
 * Duplicate step names are allowed. A frozen pipeline rejects all mutation and can be
 * shared between worker threads.
 */
public final class Pipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

    private final List<Step> steps;
    private final boolean frozen;

    public Pipeline() {
        this(new ArrayList<>(), false);
    }

    public Pipeline(Collection<Step> steps) {
        this(new ArrayList<>(steps), false);
    }

    private Pipeline(List<Step> steps, boolean frozen) {
        this.steps = steps;
        this.frozen = frozen;
    }

    public Pipeline addStep(Step step) {
        ensureMutable();
        steps.add(step);
        return this;
    }

    /**
     * Removes every step with the given name. Removing an absent name is a no-op.
     */
    public Pipeline removeStep(String name) {
        ensureMutable();
        steps.removeIf(step -> step.name().equals(name));
        return this;
    }

    public Pipeline clear() {
        ensureMutable();
        steps.clear();
        return this;
    }

    public BufferedImage process(BufferedImage image) throws TransformException {
        BufferedImage result = image;
        for (Step step : steps) {
            if (!step.appliesTo(result)) {
                LOGGER.debug("Skipping step {} (not applicable)", step.name());
                continue;
            }
            result = step.process(result);
        }
        return result;
    }

    public List<String> stepNames() {
        return steps.stream().map(Step::name).toList();
    }

    public List<Step> steps() {
        return List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Pipeline frozenCopy() {
        return new Pipeline(List.copyOf(steps), true);
    }

    /**
     * Returns a frozen copy that scales to {@code target} right after the pre-resize steps.
     * A pipeline that already contains a resize step is copied as is.
     */
    public Pipeline withResize(Resolution target) {
        List<Step> copy = new ArrayList<>(steps);
        boolean hasResize = copy.stream().anyMatch(step -> step.kind() == StepKind.RESIZE);
        if (!hasResize) {
            int insertAt = 0;
            for (int i = 0; i < copy.size(); i++) {
                if (copy.get(i).kind().preResize()) {
                    insertAt = i + 1;
                }
            }
            copy.add(insertAt, Steps.resize(target));
        }
        return new Pipeline(List.copyOf(copy), true);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Pipeline is frozen and cannot be modified");
        }
    }

    @Override
    public String toString() {
        return "Pipeline(" + (steps.isEmpty() ? "empty" : String.join(" -> ", stepNames())) + ")";
    }
}
