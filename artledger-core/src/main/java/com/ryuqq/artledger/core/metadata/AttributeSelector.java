package com.ryuqq.artledger.core.metadata;

import com.ryuqq.artledger.core.model.Attributes;
import com.ryuqq.artledger.core.model.Seed;
import com.ryuqq.artledger.core.model.Shape;

/**
 * Seed를 렌더링 속성으로 분해.
 *
 * <ul>
 *   <li>colorA = bits [24:48)</li>
 *   <li>colorB = bits [48:72)</li>
 *   <li>shape = seed mod 3</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class AttributeSelector {

    static final int COLOR_A_OFFSET = 24;
    static final int COLOR_B_OFFSET = 48;
    static final int COLOR_BITS = 24;
    static final int SHAPE_KINDS = 3;

    public Attributes select(Seed seed) {
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        int colorA = seed.bits(COLOR_A_OFFSET, COLOR_BITS);
        int colorB = seed.bits(COLOR_B_OFFSET, COLOR_BITS);
        Shape shape = Shape.fromKind(seed.mod(SHAPE_KINDS));
        return new Attributes(colorA, colorB, shape);
    }
}
