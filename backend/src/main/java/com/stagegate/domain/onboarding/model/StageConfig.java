package com.stagegate.domain.onboarding.model;

import java.util.List;

/**
 * One entry of a stage catalog.
 *
 * @param stageNumber       1-based stage number
 * @param name              display name
 * @param objective         what the stage tries to learn
 * @param keyQuestions      questions asked in priority order
 * @param dataToCollect     extracted-data keys this stage is responsible for
 * @param dataTopics        display labels for {@code dataToCollect}, same order
 * @param progressThreshold coverage the stage aims for, in [0.5, 1.0]
 */
public record StageConfig(
        int stageNumber,
        String name,
        String objective,
        List<String> keyQuestions,
        List<String> dataToCollect,
        List<StageTopic> dataTopics,
        double progressThreshold
) {
    public StageConfig {
        keyQuestions = List.copyOf(keyQuestions);
        dataToCollect = List.copyOf(dataToCollect);
        dataTopics = List.copyOf(dataTopics);
    }

    public int topicCount() {
        return dataToCollect.size();
    }
}
