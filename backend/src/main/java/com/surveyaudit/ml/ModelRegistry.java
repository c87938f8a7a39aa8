package com.surveyaudit.ml;

import com.surveyaudit.config.EngineProperties;
import com.surveyaudit.exception.ModelArtifactException;
import com.surveyaudit.model.ModelFamily;
import com.surveyaudit.model.ModelVersion;
import com.surveyaudit.nlp.TextModel;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 模型注册表：按模型族维护只追加的版本链。
 * <p>
 * 检测运行显式固定每个模型族的版本；后台训练只发布新版本，不影响已固定的运行。
 * 只有追加操作需要对版本链加锁，读取无锁。
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ModelArtifactStore store;
    private final EngineProperties properties;
    private final Clock clock;
    private final Map<ModelFamily, List<ModelVersion>> lineages = new EnumMap<>(ModelFamily.class);
    private final Map<String, ModelVersion> versionsById = new ConcurrentHashMap<>();
    private final Map<String, ModelArtifact> loaded = new ConcurrentHashMap<>();

    public ModelRegistry(ModelArtifactStore store, EngineProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        for (ModelFamily family : ModelFamily.values()) {
            lineages.put(family, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * 为尚无版本的模型族发布创世版本
     */
    @PostConstruct
    public void bootstrapDefaults() {
        publishGenesis(ModelFamily.BOT, DefaultModels.bot());
        publishGenesis(ModelFamily.ANOMALY, DefaultModels.anomaly());
        publishGenesis(ModelFamily.PATTERN, DefaultModels.pattern());
        publishGenesis(ModelFamily.TEXT, TextModel.load(
                properties.getNlp().getLexiconLocation(),
                properties.getNlp().getLanguageConfidenceFloor()));
    }

    private void publishGenesis(ModelFamily family, ModelArtifact artifact) {
        if (lineages.get(family).isEmpty()) {
            publish(family, artifact, Map.of(), null);
        }
    }

    /**
     * 追加发布新版本
     */
    public ModelVersion publish(ModelFamily family, ModelArtifact artifact, Map<String, Double> metrics, String parentVersionId) {
        if (artifact.family() != family) {
            throw new IllegalArgumentException("制品类型 " + artifact.family() + " 与模型族 " + family + " 不符");
        }
        List<ModelVersion> lineage = lineages.get(family);
        synchronized (lineage) {
            if (parentVersionId != null && lineage.stream().noneMatch(v -> v.id().equals(parentVersionId))) {
                throw new IllegalArgumentException("父版本不属于模型族 " + family + ": " + parentVersionId);
            }
            String location = store.save(family, artifact);
            int number = lineage.size() + 1;
            ModelVersion version = new ModelVersion(
                    ModelVersion.idOf(family, number), family, number, location,
                    metrics, parentVersionId, clock.instant());
            lineage.add(version);
            versionsById.put(version.id(), version);
            loaded.put(version.id(), artifact);
            log.info("发布模型版本 {} (父版本: {}, 指标: {})", version.id(), parentVersionId, metrics);
            return version;
        }
    }

    public Optional<ModelVersion> current(ModelFamily family) {
        List<ModelVersion> lineage = lineages.get(family);
        return lineage.isEmpty() ? Optional.empty() : Optional.of(lineage.get(lineage.size() - 1));
    }

    /**
     * 固定当前各模型族的最新版本
     */
    public Map<ModelFamily, String> pinCurrent() {
        Map<ModelFamily, String> pins = new EnumMap<>(ModelFamily.class);
        for (ModelFamily family : ModelFamily.values()) {
            current(family).ifPresent(v -> pins.put(family, v.id()));
        }
        return pins;
    }

    public Optional<ModelVersion> find(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(versionsById.get(versionId));
    }

    public List<ModelVersion> history(ModelFamily family) {
        return List.copyOf(lineages.get(family));
    }

    /**
     * 加载版本对应的制品，结果缓存
     *
     * @throws ModelArtifactException 无法加载或类型不符
     */
    public <T extends ModelArtifact> T load(ModelVersion version, Class<T> type) {
        ModelArtifact artifact = loaded.computeIfAbsent(version.id(), id -> store.load(version.artifactLocation()));
        if (!type.isInstance(artifact)) {
            throw new ModelArtifactException("模型 " + version.id() + " 的制品类型为 "
                    + artifact.getClass().getSimpleName() + "，期望 " + type.getSimpleName());
        }
        return type.cast(artifact);
    }

    public ModelArtifact load(ModelVersion version) {
        return load(version, ModelArtifact.class);
    }
}
