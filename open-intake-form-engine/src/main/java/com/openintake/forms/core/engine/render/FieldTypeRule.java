package com.openintake.forms.core.engine.render;

import com.openintake.forms.integration.contract.field.IOpenIntakeFieldDefinition;
import com.openintake.forms.integration.enumerations.OpenIntakeRenderCategory;

import java.util.function.Predicate;

/**
 * One row of the field type dispatch table.
 * <p>
 * Most types map to a fixed category and shape. A conditional rule switches to an
 * alternative when its predicate holds for the field.
 */
public final class FieldTypeRule {

    private final OpenIntakeRenderCategory category;
    private final ValueShape shape;
    private final Predicate<IOpenIntakeFieldDefinition> alternativeWhen;
    private final OpenIntakeRenderCategory alternativeCategory;
    private final ValueShape alternativeShape;

    private FieldTypeRule(OpenIntakeRenderCategory category, ValueShape shape,
                          Predicate<IOpenIntakeFieldDefinition> alternativeWhen,
                          OpenIntakeRenderCategory alternativeCategory, ValueShape alternativeShape) {
        this.category = category;
        this.shape = shape;
        this.alternativeWhen = alternativeWhen;
        this.alternativeCategory = alternativeCategory;
        this.alternativeShape = alternativeShape;
    }

    public static FieldTypeRule fixed(OpenIntakeRenderCategory category, ValueShape shape) {
        return new FieldTypeRule(category, shape, field -> false, category, shape);
    }

    public static FieldTypeRule conditional(OpenIntakeRenderCategory category, ValueShape shape,
                                            Predicate<IOpenIntakeFieldDefinition> alternativeWhen,
                                            OpenIntakeRenderCategory alternativeCategory,
                                            ValueShape alternativeShape) {
        return new FieldTypeRule(category, shape, alternativeWhen, alternativeCategory, alternativeShape);
    }

    public OpenIntakeRenderCategory categoryFor(IOpenIntakeFieldDefinition field) {
        return alternativeWhen.test(field) ? alternativeCategory : category;
    }

    public ValueShape shapeFor(IOpenIntakeFieldDefinition field) {
        return alternativeWhen.test(field) ? alternativeShape : shape;
    }
}
