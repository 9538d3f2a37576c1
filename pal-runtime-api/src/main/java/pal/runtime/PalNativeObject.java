package pal.runtime;

import java.util.Objects;

/**
 * 不透明的宿主对象
 */
public final class PalNativeObject extends PalValue {

    private final Object payload;

    public PalNativeObject(Object payload) {
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String getTypeName() {
        return "NativeObject";
    }

    @Override
    public PalValue equal(PalValue other) {
        if (other instanceof PalNativeObject) {
            return PalBoolean.of(payload.equals(((PalNativeObject) other).payload));
        }
        return null;
    }

    @Override
    public String toString() {
        return "<NativeObject " + payload.getClass().getSimpleName() + ">";
    }
}
