package survivor.broadphase;

import java.util.List;
import survivor.core.Collidable;

/**
 * Broadphase gera pares potenciais de colisão (pruning grosso). Implementações são reconstruídas a cada tick: limpar
 * via {@link #clear()}, inserir as entidades e só então consultar {@link #computePairs()}.
 *
 * @param <T> tipo das entidades indexadas
 */
public interface Broadphase<T extends Collidable> {

    /**
     * Limpa qualquer estrutura interna (antes de uma nova construção). Idempotente.
     */
    void clear();

    /**
     * Insere uma referência à entidade, usando sua posição atual.
     *
     * @param entity entidade
     * @return true se a entidade foi indexada
     */
    boolean insert(T entity);

    /**
     * Retorna a lista de pares potencialmente colidentes. Pares não se repetem, não incluem (a==b) e só contêm
     * entidades ativas e vivas.
     */
    List<CollisionPair<T>> computePairs();

    /**
     * Número de entidades indexadas desde o último {@link #clear()}.
     */
    int size();

    /**
     * Par não ordenado (a,b). Não carrega resultado geométrico.
     */
    record CollisionPair<T extends Collidable>(T a, T b) {

        /**
         * Retorna o outro membro do par.
         *
         * @param e um dos membros
         * @return o outro membro, ou null se {@code e} não pertence ao par
         */
        public T other(T e) {
            if (e == a) {
                return b;
            }
            if (e == b) {
                return a;
            }
            return null;
        }

        /**
         * Indica se o par contém a entidade (por referência).
         */
        public boolean contains(Collidable e) {
            return e == a || e == b;
        }
    }
}
