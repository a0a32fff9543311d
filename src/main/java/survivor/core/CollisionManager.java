package survivor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survivor.broadphase.Broadphase;
import survivor.broadphase.Broadphase.CollisionPair;
import survivor.broadphase.GridSettings;
import survivor.broadphase.SpatialGrid;
import survivor.collision.Bounds;
import survivor.collision.Collision;
import survivor.collision.CollisionResult;

/**
 * Orquestrador de colisões por tick. Instância única e de longa duração, dona da broadphase: a cada tick limpa e
 * repopula a grade, guarda os pares candidatos e oferece consultas de conveniência para a camada de gameplay.
 * <p>
 * Protocolo estritamente sequencial (clear → populate → query) na thread do loop principal; sem sincronização.
 *
 * @param <T> tipo das entidades do jogo
 */
public final class CollisionManager<T extends Collidable> {
    private static final Logger log = LoggerFactory.getLogger(CollisionManager.class);

    private final Broadphase<T> broadphase;
    private List<CollisionPair<T>> candidatePairs = Collections.emptyList();
    private CollisionStats lastStats = CollisionStats.EMPTY;

    /**
     * Alvo atingido em {@link #checkEntityAgainstList(Collidable, List)}.
     */
    public record Hit<T>(T target, CollisionResult result) {
    }

    /**
     * Par candidato confirmado pela narrowphase.
     */
    public record Contact<T>(T a, T b, CollisionResult result) {
    }

    /**
     * Cria o orquestrador com a grade padrão (800×600, células de 50 px).
     */
    public CollisionManager() {
        this(GridSettings.DEFAULT);
    }

    /**
     * @param settings parâmetros da grade
     */
    public CollisionManager(GridSettings settings) {
        this(new SpatialGrid<>(settings));
    }

    /**
     * Usa uma broadphase arbitrária (ex.: {@link survivor.broadphase.BruteForceBroadphase}).
     *
     * @param broadphase broadphase, de posse exclusiva deste orquestrador
     */
    public CollisionManager(Broadphase<T> broadphase) {
        this.broadphase = Objects.requireNonNull(broadphase, "broadphase");
    }

    /**
     * Reconstrói a broadphase com as entidades deste tick e calcula os pares candidatos. Não roda narrowphase.
     * <br>
     * Deve ser chamado exatamente uma vez por tick. Entidades inativas, mortas ou nulas são ignoradas.
     *
     * @param entities snapshot das entidades do tick
     */
    public void update(List<? extends T> entities) {
        long t0 = System.nanoTime();

        broadphase.clear();
        int inserted = 0;
        for (T e : entities) {
            if (e != null && e.participates() && broadphase.insert(e)) {
                inserted++;
            }
        }
        candidatePairs = Collections.unmodifiableList(broadphase.computePairs());

        int occupied = 0;
        int largest = 0;
        if (broadphase instanceof SpatialGrid<?> grid) {
            occupied = grid.occupiedCells();
            largest = grid.largestBucket();
        }
        lastStats = new CollisionStats(entities.size(), inserted, candidatePairs.size(), occupied, largest,
            System.nanoTime() - t0);

        if (log.isTraceEnabled()) {
            log.trace("tick: {}", lastStats);
        }
    }

    /**
     * Pares candidatos do último {@link #update(List)}; estáveis até o próximo. Vazio antes do primeiro update.
     *
     * @return lista imutável de pares
     */
    public List<CollisionPair<T>> getCandidatePairs() {
        return candidatePairs;
    }

    /**
     * Roda {@link #checkPair(Collidable, Collidable)} sobre os pares candidatos do último tick e retorna apenas os
     * que colidem de fato.
     *
     * @return contatos confirmados
     */
    public List<Contact<T>> resolveCandidatePairs() {
        List<Contact<T>> out = new ArrayList<>();
        for (CollisionPair<T> pair : candidatePairs) {
            CollisionResult r = checkPair(pair.a(), pair.b());
            if (r.collided()) {
                out.add(new Contact<>(pair.a(), pair.b(), r));
            }
        }
        return out;
    }

    /**
     * Testa uma entidade contra uma lista de alvos, sem usar a grade. Pensado para listas pequenas (ex.: um projétil
     * contra inimigos já filtrados por alcance).
     *
     * @param entity entidade de origem
     * @param targets alvos; a própria entidade e alvos inativos/mortos são ignorados
     * @return alvos atingidos, na ordem da lista
     */
    public List<Hit<T>> checkEntityAgainstList(T entity, List<? extends T> targets) {
        List<Hit<T>> hits = new ArrayList<>();
        for (T target : targets) {
            if (target == null || target == entity || !target.participates()) {
                continue;
            }
            CollisionResult r = checkPair(entity, target);
            if (r.collided()) {
                hits.add(new Hit<>(target, r));
            }
        }
        return hits;
    }

    /**
     * Testa duas entidades como círculos, escolhendo o raio pelo tipo de colisor:
     * <ul>
     *   <li>ambas com raio explícito → seus raios;</li>
     *   <li>senão, ambas com tamanho → tamanhos como raio;</li>
     *   <li>senão, cada uma usa tamanho, raio ou {@value Collider#DEFAULT_RADIUS}, nessa ordem.</li>
     * </ul>
     * Caixas nunca são escolhidas aqui; para AABB use {@link Collision} diretamente.
     *
     * @param a primeira entidade
     * @param b segunda entidade
     * @return resultado Círculo–Círculo com normal a → b
     */
    public CollisionResult checkPair(Collidable a, Collidable b) {
        Collider ca = a.collider();
        Collider cb = b.collider();

        double ra;
        double rb;
        if (ca.hasRadius() && cb.hasRadius()) {
            ra = ca.radius();
            rb = cb.radius();
        } else if (ca.hasSize() && cb.hasSize()) {
            ra = ca.size();
            rb = cb.size();
        } else {
            ra = ca.fallbackRadius();
            rb = cb.fallbackRadius();
        }
        return Collision.testCircleCircle(Bounds.circle(a, ra), Bounds.circle(b, rb));
    }

    /**
     * Esvazia a broadphase e descarta os pares do último tick.
     */
    public void reset() {
        broadphase.clear();
        candidatePairs = Collections.emptyList();
        lastStats = CollisionStats.EMPTY;
    }

    /**
     * Estatísticas do último {@link #update(List)}.
     */
    public CollisionStats getLastStats() {
        return lastStats;
    }

    /**
     * Broadphase de posse deste orquestrador.
     */
    public Broadphase<T> broadphase() {
        return broadphase;
    }
}
