package com.fulfillment.pipeline.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PipelineLeaseService with mocked Redis.
 */
@ExtendWith(MockitoExtension.class)
class PipelineLeaseServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private PipelineLeaseService leaseService;

    @BeforeEach
    void setUp() {
        leaseService = new PipelineLeaseService(redisTemplate, Duration.ofMinutes(10));
    }

    @Test
    void acquiresFreeLease() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("fulfillment:lease:ORD_1"), anyString(), eq(Duration.ofMinutes(10)))).thenReturn(true);

        PipelineLeaseService.Lease lease = leaseService.tryAcquire("ORD_1");

        assertThat(lease.isAcquired()).isTrue();
        assertThat(lease.getToken()).isNotBlank();
    }

    @Test
    void heldLeaseIsNotAcquired() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertThat(leaseService.tryAcquire("ORD_1").isAcquired()).isFalse();
    }

    @Test
    void redisOutageFailsOpen() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("refused"));

        PipelineLeaseService.Lease lease = leaseService.tryAcquire("ORD_1");

        assertThat(lease.isAcquired()).isTrue();
        assertThat(lease.getToken()).isNull();
    }

    @Test
    void releaseDeletesOnlyWithOwnToken() {
        leaseService.release(new PipelineLeaseService.Lease("ORD_1", "token-1", true));

        verify(redisTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of("fulfillment:lease:ORD_1")), eq("token-1"));
    }

    @Test
    void unbackedLeaseReleaseIsNoop() {
        leaseService.release(new PipelineLeaseService.Lease("ORD_1", null, true));

        verifyNoInteractions(redisTemplate);
    }
}
