package fr.imt.scanzilla.scanzilla.infrastructure.redis;

import fr.imt.scanzilla.scanzilla.business.model.AnalysisStatus;
import fr.imt.scanzilla.scanzilla.business.port.AnalysisStatusPublisherPort;
import fr.imt.scanzilla.scanzilla.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisAnalysisStatusPublisherAdapter implements AnalysisStatusPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(String batchId, String repository, AnalysisStatus status) {
        try {
            // batchId|repository|status
            String message = String.format("%s|%s|%s", batchId, repository, status);
            redisTemplate.convertAndSend(RedisConfiguration.ANALYSIS_STATUS_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to publish analysis status of {} in batch {}", repository, batchId, e);
        }
    }
}
