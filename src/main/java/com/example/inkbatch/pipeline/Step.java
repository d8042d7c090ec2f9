package com.example.inkbatch.pipeline;

import com.example.inkbatch.error.TransformException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named, configured image transform. Configuration is fixed at construction.
 * Steps never retry; a failed attempt surfaces as a {@link TransformException}.
 */
public final class Step {
    private final String name;
    private final StepKind kind;
    private final StepParameters parameters;
    private final Operation operation;
    private final Predicate<BufferedImage> applicability;

    private Step(String name,
                 StepKind kind,
                 StepParameters parameters,
                 Operation operation,
                 Predicate<BufferedImage> applicability) {
        this.name = name;
        this.kind = kind;
        this.parameters = parameters;
        this.operation = operation;
        this.applicability = applicability;
    }

    public static <P extends StepParameters> Step of(String name,
                                                     StepKind kind,
                                                     P parameters,
                                                     ImageTransform<? super P> transform) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(transform, "transform");
        return new Step(name, kind, parameters, image -> transform.apply(image, parameters), image -> true);
    }

    /**
     * Returns a copy of this step that the pipeline only invokes for images matching {@code condition}.
     */
    public Step when(Predicate<BufferedImage> condition) {
        return new Step(name, kind, parameters, operation, applicability.and(condition));
    }

    public boolean appliesTo(BufferedImage image) {
        return applicability.test(image);
    }

    public BufferedImage process(BufferedImage image) throws TransformException {
        BufferedImage result;
        try {
            result = operation.apply(image);
        } catch (TransformException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new TransformException(name, ex, true);
        } catch (Exception ex) {
            throw new TransformException(name, ex, false);
        }
        if (result == null) {
            throw new TransformException(name, "Transform produced no image", false);
        }
        return result;
    }

    public String name() {
        return name;
    }

    public StepKind kind() {
        return kind;
    }

    public StepParameters parameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return name + "(" + parameters + ")";
    }

    @FunctionalInterface
    private interface Operation {
        BufferedImage apply(BufferedImage image) throws Exception;
    }
}
