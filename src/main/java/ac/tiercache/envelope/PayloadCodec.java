package ac.tiercache.envelope;

import ac.tiercache.tier.CorruptEntryException;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.esotericsoftware.kryo.util.Pool;
import org.objenesis.strategy.StdInstantiatorStrategy;

/**
 * Turns arbitrary values into bytes and back with Kryo. Kryo instances are not thread-safe,
 * so they are borrowed from a pool for each call.
 */
public final class PayloadCodec {
    private static final int INITIAL_BUFFER = 256;

    private final Pool<Kryo> kryoPool = new Pool<Kryo>(true, false, 16) {
        @Override
        protected Kryo create() {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(true);
            kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
            return kryo;
        }
    };

    public byte[] encode(Object value) {
        Kryo kryo = kryoPool.obtain();
        try (Output output = new Output(INITIAL_BUFFER, -1)) {
            kryo.writeClassAndObject(output, value);
            return output.toBytes();
        } finally {
            kryoPool.free(kryo);
        }
    }

    /**
     * Returns a value equal to {@code value} that shares no mutable state with it. Strings,
     * boxed primitives and enums are returned as they are.
     */
    public Object copy(Object value) throws CorruptEntryException {
        if (isImmutable(value)) {
            return value;
        }
        return decode(encode(value));
    }

    public Object decode(byte[] bytes) throws CorruptEntryException {
        if (bytes.length == 0) {
            throw new CorruptEntryException("Empty payload");
        }
        Kryo kryo = kryoPool.obtain();
        try (Input input = new Input(bytes)) {
            Object value = kryo.readClassAndObject(input);
            if (value == null) {
                throw new CorruptEntryException("Payload decoded to null");
            }
            return value;
        } catch (KryoException | IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new CorruptEntryException("Unreadable payload: " + e.getMessage(), e);
        } finally {
            kryoPool.free(kryo);
        }
    }

    private static boolean isImmutable(Object value) {
        return value instanceof String || value instanceof Number && value.getClass().getName().startsWith("java.lang.")
                || value instanceof Boolean || value instanceof Character || value instanceof Enum;
    }
}
