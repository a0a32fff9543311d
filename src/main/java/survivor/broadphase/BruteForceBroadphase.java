package survivor.broadphase;

import java.util.ArrayList;
import java.util.List;
import survivor.core.Collidable;

/**
 * Broadphase brute-force O(n²): todo par de entidades participantes é candidato. Referência para validar a grade e
 * alternativa para cenas muito pequenas.
 */
public final class BruteForceBroadphase<T extends Collidable> implements Broadphase<T> {
    private final List<T> entities = new ArrayList<>();

    @Override
    public void clear() {
        entities.clear();
    }

    @Override
    public boolean insert(T entity) {
        entities.add(entity);
        return true;
    }

    @Override
    public List<CollisionPair<T>> computePairs() {
        List<CollisionPair<T>> out = new ArrayList<>();
        int n = entities.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                T a = entities.get(i);
                T b = entities.get(j);
                if (Collidable.canCollide(a, b)) {
                    out.add(new CollisionPair<>(a, b));
                }
            }
        }
        return out;
    }

    @Override
    public int size() {
        return entities.size();
    }
}
