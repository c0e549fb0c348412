package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.adapter.inmemory.cache.InMemoryResponseCache;
import com.ryuqq.jukebox.adapter.inmemory.credential.InMemoryCredentialPool;
import com.ryuqq.jukebox.adapter.inmemory.credential.InMemoryCredentialStateStore;
import com.ryuqq.jukebox.adapter.inmemory.ratelimit.SlidingWindowRateLimiter;
import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.application.search.SearchFallbackChain;
import com.ryuqq.jukebox.application.search.VideoSearchService;
import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.clock.SystemClock;
import com.ryuqq.jukebox.core.protection.RateLimiter;
import com.ryuqq.jukebox.core.spi.CredentialSource;
import com.ryuqq.jukebox.core.spi.CredentialStateStore;
import com.ryuqq.jukebox.core.spi.DispatchScheduler;
import com.ryuqq.jukebox.core.spi.QuotaProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 단위 구성 요소 묶음.
 *
 * <p>RateLimiter, ResponseCache, CredentialPool, 요청 대기열과 QuotaErrorHandler,
 * 검색 유스케이스를 한 번 생성해 연결합니다. 프로세스당 하나를 만들어 참조로 전달하고,
 * 테스트는 매번 새 인스턴스를 만듭니다.</p>
 *
 * <p><strong>연결 관계:</strong></p>
 * <pre>
 * PriorityRequestQueue ── consults ──▶ SlidingWindowRateLimiter
 *        │
 *        └─ FailureListener ──▶ QuotaErrorHandler ── rotate ──▶ InMemoryCredentialPool
 *
 * SearchFallbackChain ──▶ VideoSearchService ──▶ PriorityRequestQueue / InMemoryResponseCache
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class JukeboxContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JukeboxContext.class);

    private final SlidingWindowRateLimiter rateLimiter;
    private final InMemoryResponseCache responseCache;
    private final InMemoryCredentialPool credentialPool;
    private final PriorityRequestQueue requestQueue;
    private final QuotaErrorHandler quotaErrorHandler;
    private final VideoSearchService searchService;
    private final SearchFallbackChain searchChain;

    /**
     * 모든 협력 객체를 직접 지정하는 생성자.
     *
     * <p>캐시의 주기적 정리는 시작하지 않습니다. 필요하면 {@link #startBackgroundTasks()}를 호출합니다.</p>
     *
     * @param settings 구성 설정
     * @param credentialSource 자격 증명 후보
     * @param quotaProbe 쿼터 사용률 probe
     * @param stateStore 활성 키 / 이력 저장소
     * @param backends 검색 백엔드
     * @param scheduler drain loop 스케줄러
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JukeboxContext(
        JukeboxSettings settings,
        CredentialSource credentialSource,
        QuotaProbe quotaProbe,
        CredentialStateStore stateStore,
        SearchBackends backends,
        DispatchScheduler scheduler,
        Clock clock
    ) {
        if (settings == null || credentialSource == null || quotaProbe == null || stateStore == null
            || backends == null || scheduler == null || clock == null) {
            throw new IllegalArgumentException("All collaborators are required for JukeboxContext");
        }

        this.rateLimiter = new SlidingWindowRateLimiter(settings.serviceLimits(), clock);
        this.responseCache = new InMemoryResponseCache(settings.cacheConfig(), clock);
        this.credentialPool = new InMemoryCredentialPool(
            credentialSource, quotaProbe, stateStore, settings.credentialPoolConfig(), clock
        );
        this.requestQueue = new PriorityRequestQueue(rateLimiter, scheduler, settings.queueConfig());
        this.quotaErrorHandler = new QuotaErrorHandler(
            credentialPool, settings.credentialPoolConfig().meteredService()
        );
        this.requestQueue.addFailureListener(quotaErrorHandler);

        this.searchService = new VideoSearchService(
            requestQueue, credentialPool, backends.api(), responseCache, settings.cacheConfig().defaultTtl()
        );
        this.searchChain = new SearchFallbackChain(searchService, backends.proxy(), backends.scraper(), requestQueue);

        log.info("Jukebox context created ({} credentials, manual configuration required: {})",
            credentialPool.getCredentials().size(), credentialPool.requiresManualConfiguration());
    }

    /**
     * 운영 기본값으로 생성하고 백그라운드 작업을 시작합니다.
     *
     * <p>단일 daemon dispatch 스레드, 시스템 시계, 메모리 상태 저장소를 사용하며,
     * 시작 시 한 번 쿼터 사용률을 읽어 옵니다.</p>
     *
     * @param settings 구성 설정
     * @param credentialSource 자격 증명 후보
     * @param quotaProbe 쿼터 사용률 probe
     * @param backends 검색 백엔드
     * @return 시작된 JukeboxContext
     */
    public static JukeboxContext start(
        JukeboxSettings settings,
        CredentialSource credentialSource,
        QuotaProbe quotaProbe,
        SearchBackends backends
    ) {
        JukeboxContext context = new JukeboxContext(
            settings,
            credentialSource,
            quotaProbe,
            new InMemoryCredentialStateStore(),
            backends,
            new SingleThreadDispatchScheduler(),
            SystemClock.INSTANCE
        );
        context.credentialPool.refreshQuota();
        context.startBackgroundTasks();
        return context;
    }

    /**
     * 캐시 주기적 정리 시작 (중복 호출 무시).
     */
    public void startBackgroundTasks() {
        responseCache.startPeriodicSweep();
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public InMemoryResponseCache responseCache() {
        return responseCache;
    }

    public CredentialPool credentialPool() {
        return credentialPool;
    }

    public PriorityRequestQueue requestQueue() {
        return requestQueue;
    }

    public QuotaErrorHandler quotaErrorHandler() {
        return quotaErrorHandler;
    }

    public VideoSearchService searchService() {
        return searchService;
    }

    public SearchFallbackChain searchChain() {
        return searchChain;
    }

    /**
     * 대기열과 백그라운드 작업 종료.
     */
    @Override
    public void close() {
        requestQueue.shutdown();
        responseCache.close();
        log.info("Jukebox context closed");
    }
}
