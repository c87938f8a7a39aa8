package com.surveyaudit.ml;

import com.surveyaudit.exception.ModelArtifactException;
import com.surveyaudit.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class InMemoryModelArtifactStore implements ModelArtifactStore {

    private final Map<String, ModelArtifact> artifacts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String save(ModelFamily family, ModelArtifact artifact) {
        if (artifact.family() != family) {
            throw new IllegalArgumentException("制品类型 " + artifact.family() + " 与模型族 " + family + " 不符");
        }
        String location = "mem://" + family.name().toLowerCase(Locale.ROOT) + "/" + sequence.incrementAndGet();
        artifacts.put(location, artifact);
        return location;
    }

    @Override
    public ModelArtifact load(String location) {
        ModelArtifact artifact = artifacts.get(location);
        if (artifact == null) {
            throw new ModelArtifactException("模型制品不存在: " + location);
        }
        return artifact;
    }
}
