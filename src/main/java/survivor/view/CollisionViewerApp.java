package survivor.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import javafx.animation.AnimationTimer;
import javafx.application.Application;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Label;
import javafx.scene.input.MouseButton;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survivor.broadphase.Broadphase.CollisionPair;
import survivor.broadphase.GridSettings;
import survivor.broadphase.InsertionMode;
import survivor.core.CollisionManager;
import survivor.core.CollisionStats;
import survivor.core.EntityType;
import survivor.core.GameEntity;
import survivor.math.Vec2;

/**
 * Viewer 2D para inspecionar a broadphase e a narrowphase.
 * <p>
 * Funcionalidades:
 * <ul>
 *   <li>Grade uniforme desenhada sobre o mundo, células ocupadas destacadas</li>
 *   <li>Entidades vagando; amarelo = em par candidato, vermelho = colisão confirmada</li>
 *   <li>HUD com FPS, entidades, pares candidatos e contatos</li>
 *   <li>Teclas: R reset | G mostra/esconde grid | E alterna inserção POINT/EXTENT | Espaço gera uma leva</li>
 *   <li>Clique direito: dispara um projétil a partir do jogador em direção ao clique</li>
 * </ul>
 */
public class CollisionViewerApp extends Application {
    private static final Logger log = LoggerFactory.getLogger(CollisionViewerApp.class);

    /**
     * Entidades iniciais.
     */
    private static final int INITIAL_ENEMIES = 60;

    /**
     * Entidades geradas por leva (Espaço).
     */
    private static final int BURST = 20;

    /**
     * Velocidade dos projéteis (px/s).
     */
    private static final double PROJECTILE_SPEED = 420.0;

    private final Random random = new Random(42);

    /**
     * Velocidade (px/s) de cada entidade. A simulação é só para demonstração: anda em linha reta e rebate nas bordas.
     */
    private final Map<GameEntity, Vec2> velocities = new IdentityHashMap<>();

    private final List<GameEntity> entities = new ArrayList<>();

    /**
     * Contatos confirmados no último tick (desenhados até o próximo).
     */
    private List<CollisionManager.Contact<GameEntity>> contacts = List.of();

    private GridSettings settings = GridSettings.DEFAULT;

    private CollisionManager<GameEntity> collisions;

    private GameEntity player;

    private Canvas canvas;

    private Label hud;

    private boolean showGrid = true;

    private double fpsTime = 0;

    private int fpsFrames = 0;

    private double fps = 0;

    /**
     * Inicializa a aplicação JavaFX, monta o canvas, HUD e interações.
     *
     * @param stage Palco principal da aplicação.
     */
    @Override
    public void start(Stage stage) {
        setupWorld();

        canvas = new Canvas(settings.worldWidth(), settings.worldHeight());
        hud = new Label(helpText());
        hud.setTextFill(Color.web("#e6eef7"));
        hud.setFont(Font.font("Consolas", 13));
        hud.setPadding(new Insets(8));
        StackPane root = new StackPane(canvas, hud);
        StackPane.setAlignment(hud, Pos.TOP_LEFT);
        root.setStyle("-fx-background-color: #0c0f14;");

        Scene scene = new Scene(root);
        stage.setTitle("Collision Viewer");
        stage.setScene(scene);
        stage.show();

        scene.setOnKeyPressed(e -> {
            switch (e.getCode()) {
                case R -> setupWorld();
                case G -> showGrid = !showGrid;
                case E -> toggleInsertionMode();
                case SPACE -> spawnEnemies(BURST);
                default -> {
                }
            }
        });

        canvas.setOnMouseClicked(e -> {
            if (e.getButton() == MouseButton.SECONDARY) {
                fireProjectile(e.getX(), e.getY());
            }
        });

        // loop 60Hz
        AnimationTimer timer = new AnimationTimer() {
            long lastNanos = -1;
            double acc = 0.0;

            @Override
            public void handle(long now) {
                if (lastNanos < 0) {
                    lastNanos = now;
                    return;
                }
                double dt = (now - lastNanos) / 1e9;
                lastNanos = now;

                acc += dt;
                double tickDt = 1.0 / 60.0;
                while (acc >= tickDt) {
                    tick(tickDt);
                    acc -= tickDt;
                }
                render();
                updateHud(dt);
            }
        };
        timer.start();
    }

    // ===== Mundo de demonstração =====

    /**
     * Cria as entidades de demonstração e um orquestrador novo com as configurações atuais.
     */
    private void setupWorld() {
        entities.clear();
        velocities.clear();
        contacts = List.of();
        collisions = new CollisionManager<>(settings);

        player = GameEntity.withRadius(EntityType.PLAYER, settings.worldWidth() / 2, settings.worldHeight() / 2, 20);
        entities.add(player);
        velocities.put(player, Vec2.ZERO);

        spawnEnemies(INITIAL_ENEMIES);
        for (int i = 0; i < 8; i++) {
            var pickup = GameEntity.unsized(EntityType.PICKUP,
                random.nextDouble() * settings.worldWidth(), random.nextDouble() * settings.worldHeight());
            entities.add(pickup);
            velocities.put(pickup, Vec2.ZERO);
        }
        log.debug("Mundo de demonstração com {} entidades ({})", entities.size(), settings.insertionMode());
    }

    /**
     * Gera {@code n} inimigos em posições e direções aleatórias.
     */
    private void spawnEnemies(int n) {
        for (int i = 0; i < n; i++) {
            var enemy = GameEntity.withSize(EntityType.ENEMY,
                random.nextDouble() * settings.worldWidth(), random.nextDouble() * settings.worldHeight(),
                8 + random.nextDouble() * 10);
            double angle = random.nextDouble() * 2 * Math.PI;
            double speed = 30 + random.nextDouble() * 60;
            entities.add(enemy);
            velocities.put(enemy, new Vec2(Math.cos(angle), Math.sin(angle)).mul(speed));
        }
    }

    /**
     * Dispara um projétil do jogador em direção a (tx, ty).
     */
    private void fireProjectile(double tx, double ty) {
        Vec2 direction = new Vec2(tx, ty).sub(player.position()).normalized();
        var projectile = GameEntity.withSize(EntityType.PROJECTILE, player.x(), player.y(), 4);
        entities.add(projectile);
        velocities.put(projectile, direction.mul(PROJECTILE_SPEED));
    }

    /**
     * Recria o orquestrador alternando entre inserção por ponto e por extensão.
     */
    private void toggleInsertionMode() {
        InsertionMode next = settings.insertionMode() == InsertionMode.POINT ? InsertionMode.EXTENT
            : InsertionMode.POINT;
        settings = settings.withInsertionMode(next);
        collisions = new CollisionManager<>(settings);
        contacts = List.of();
        log.info("Modo de inserção: {}", next);
    }

    /**
     * Um tick: move, atualiza a broadphase e aplica o gameplay mínimo (projétil mata inimigo, some ao sair do mundo).
     */
    private void tick(double dt) {
        for (GameEntity e : entities) {
            Vec2 v = velocities.get(e);
            e.setPosition(e.position().add(v.mul(dt)));
            if (e.type() == EntityType.PROJECTILE) {
                if (e.x() < 0 || e.y() < 0 || e.x() > settings.worldWidth() || e.y() > settings.worldHeight()) {
                    e.setActive(false);
                }
                continue;
            }
            if (e.x() < 0 || e.x() > settings.worldWidth()) {
                velocities.put(e, new Vec2(-v.x(), v.y()));
            }
            if (e.y() < 0 || e.y() > settings.worldHeight()) {
                velocities.put(e, new Vec2(velocities.get(e).x(), -v.y()));
            }
        }

        collisions.update(entities);

        contacts = collisions.resolveCandidatePairs();
        for (var contact : contacts) {
            GameEntity a = contact.a();
            GameEntity b = contact.b();
            if (a.type() == EntityType.PROJECTILE && b.type() == EntityType.ENEMY) {
                b.kill();
                a.setActive(false);
            } else if (b.type() == EntityType.PROJECTILE && a.type() == EntityType.ENEMY) {
                a.kill();
                b.setActive(false);
            }
        }

        entities.removeIf(e -> {
            boolean gone = e.isDead() || !e.isActive();
            if (gone) {
                velocities.remove(e);
            }
            return gone;
        });
    }

    // ===== Desenho =====

    /**
     * Desenha grade, entidades e destaques de pares/contatos.
     */
    private void render() {
        GraphicsContext g = canvas.getGraphicsContext2D();
        g.setFill(Color.web("#0c0f14"));
        g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

        if (showGrid) {
            drawGrid(g);
        }

        Set<GameEntity> inPair = Collections.newSetFromMap(new IdentityHashMap<>());
        for (CollisionPair<GameEntity> pair : collisions.getCandidatePairs()) {
            inPair.add(pair.a());
            inPair.add(pair.b());
        }
        Set<GameEntity> touching = Collections.newSetFromMap(new IdentityHashMap<>());
        g.setStroke(Color.web("#ff4f4f"));
        g.setLineWidth(1.5);
        for (var contact : contacts) {
            touching.add(contact.a());
            touching.add(contact.b());
            g.strokeLine(contact.a().x(), contact.a().y(), contact.b().x(), contact.b().y());
        }

        for (GameEntity e : entities) {
            double r = e.collider().fallbackRadius();
            Color c = baseColor(e.type());
            if (touching.contains(e)) {
                c = Color.web("#ff4f4f");
            } else if (inPair.contains(e)) {
                c = Color.web("#ffd23f");
            }
            g.setFill(c);
            g.fillOval(e.x() - r, e.y() - r, 2 * r, 2 * r);
        }
    }

    /**
     * Desenha as linhas da grade e sombreia as células ocupadas no tick atual.
     */
    private void drawGrid(GraphicsContext g) {
        double cell = settings.cellSize();
        double w = settings.worldWidth();
        double h = settings.worldHeight();

        g.setFill(Color.web("#141a24"));
        for (GameEntity e : entities) {
            double cx = Math.floor(Math.max(0, Math.min(e.x(), w - 1)) / cell) * cell;
            double cy = Math.floor(Math.max(0, Math.min(e.y(), h - 1)) / cell) * cell;
            g.fillRect(cx, cy, cell, cell);
        }

        g.setStroke(Color.web("#222a36"));
        g.setLineWidth(1);
        for (double x = 0; x <= w; x += cell) {
            g.strokeLine(x, 0, x, h);
        }
        for (double y = 0; y <= h; y += cell) {
            g.strokeLine(0, y, w, y);
        }
    }

    private Color baseColor(EntityType type) {
        return switch (type) {
            case PLAYER -> Color.web("#3fa7ff");
            case ENEMY -> Color.web("#9aa5b1");
            case PROJECTILE -> Color.web("#e6eef7");
            case PICKUP -> Color.web("#5fd068");
        };
    }

    // ===== HUD/FPS =====

    /**
     * Atualiza o HUD com FPS e estatísticas do último tick.
     *
     * @param dt Delta de tempo desde o último frame
     */
    private void updateHud(double dt) {
        fpsTime += dt;
        fpsFrames++;
        if (fpsTime >= 0.5) {
            fps = fpsFrames / fpsTime;
            fpsFrames = 0;
            fpsTime = 0;
            hud.setText(helpText());
        }
    }

    /**
     * Retorna o texto do HUD.
     *
     * @return Texto formatado
     */
    private String helpText() {
        CollisionStats s = collisions.getLastStats();
        return """
                   Collision Viewer
                   Teclas: R = reset | G = toggle grid | E = POINT/EXTENT | Espaço = nova leva
                   Clique direito = disparar projétil
                   """
               + String.format("FPS: %.1f | Modo: %s | Entidades: %d | Pares: %d | Células: %d | Maior: %d | %.1f µs",
            fps, settings.insertionMode(), s.inserted(), s.candidatePairs(), s.occupiedCells(), s.largestBucket(),
            s.elapsedNanos() / 1000.0);
    }

    public static void main(String[] args) {
        launch(args);
    }
}
