package ac.tiercache.pool;

@FunctionalInterface
public interface ConnectionCallback<C, T> {
    T doWith(C connection) throws Exception;
}
