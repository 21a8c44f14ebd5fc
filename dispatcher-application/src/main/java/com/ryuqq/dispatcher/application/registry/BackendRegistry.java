package com.ryuqq.dispatcher.application.registry;

import com.ryuqq.dispatcher.application.config.DispatcherConfig;
import com.ryuqq.dispatcher.core.priority.DispatcherPriority;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 디스패처 백엔드 레지스트리.
 *
 * <p>우선순위 순으로 정렬된 백엔드 목록을 관리하고, 현재 프로세스에서 사용할 백엔드를
 * 해석(resolve)하여 캐싱합니다.</p>
 *
 * <p><strong>해석 순서:</strong></p>
 * <ol>
 *   <li>캐시된 백엔드가 현재 세대(generation)의 것이면 즉시 반환 (단일 atomic load)</li>
 *   <li>빌트인 백엔드를 최초 1회 등록</li>
 *   <li>강제 지정(시스템 프로퍼티 → 환경 변수)이 있으면 표시 이름을 대소문자 무시로 비교하여
 *       시도. 일치하는 항목이 없거나 사용 불가/생성 실패 시 WARN 후 일반 탐색으로 진행</li>
 *   <li>우선순위 내림차순(동일 우선순위는 등록 순)으로 생성 + 가용성 탐지,
 *       첫 번째 사용 가능한 백엔드 선택</li>
 *   <li>모두 실패하면 {@link BackendResolutionException}</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>목록은 {@link ReentrantReadWriteLock}으로 보호</li>
 *   <li>목록 변경은 세대를 증가시키고 캐시를 비움</li>
 *   <li>오래된 세대로 계산된 해석 결과는 호출자에게는 반환되지만 캐시되지 않음</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);
    private static final BackendRegistry GLOBAL = new BackendRegistry();

    private static final Comparator<Entry> ORDER =
        Comparator.comparingInt(Entry::priority).reversed().thenComparingLong(Entry::sequence);

    /**
     * 키-값 조회 함수 (환경 변수, 시스템 프로퍼티).
     */
    @FunctionalInterface
    public interface Lookup {
        String get(String key);
    }

    private final DispatcherConfig config;
    private final Lookup environment;
    private final Lookup properties;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Entry> entries = new ArrayList<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<Resolution> cached = new AtomicReference<>();
    private long nextSequence;
    private boolean seeded;

    /**
     * 프로세스 환경(System.getenv/getProperty)을 사용하는 레지스트리 생성.
     */
    public BackendRegistry() {
        this(new DispatcherConfig(), System::getenv, System::getProperty);
    }

    /**
     * 레지스트리 생성.
     *
     * @param config 강제 지정 키 이름을 담은 설정
     * @param environment 환경 변수 조회
     * @param properties 시스템 프로퍼티 조회
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BackendRegistry(DispatcherConfig config, Lookup environment, Lookup properties) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        this.config = config;
        this.environment = environment;
        this.properties = properties;
    }

    /**
     * 프로세스 전역 레지스트리.
     *
     * @return 전역 인스턴스
     */
    public static BackendRegistry global() {
        return GLOBAL;
    }

    /**
     * 스펙에서 파생된 이름으로 백엔드 등록.
     *
     * @see #register(BackendSpec, int, String)
     */
    public void register(BackendSpec spec, int priority) {
        register(spec, priority, null);
    }

    /**
     * 백엔드 등록.
     *
     * <p>이미 등록된 스펙이면 새 항목을 추가하지 않고 우선순위와 이름만 갱신합니다
     * (등록 순서는 유지). 캐시를 무효화합니다.</p>
     *
     * @param spec 백엔드 스펙
     * @param priority 우선순위 (높을수록 먼저 시도)
     * @param name 표시 이름 (null 또는 빈 문자열이면 스펙에서 파생)
     * @throws IllegalArgumentException spec이 null인 경우
     */
    public void register(BackendSpec spec, int priority, String name) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        String displayName = (name == null || name.isBlank()) ? spec.displayName() : name;

        lock.writeLock().lock();
        try {
            int index = indexOf(spec);
            if (index >= 0) {
                Entry existing = entries.get(index);
                entries.set(index, new Entry(priority, spec, displayName, existing.sequence()));
                log.debug("Updated dispatcher backend {} with priority {}", displayName, priority);
            } else {
                entries.add(new Entry(priority, spec, displayName, nextSequence++));
                log.debug("Registered dispatcher backend {} with priority {}", displayName, priority);
            }
            entries.sort(ORDER);
            invalidate();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 백엔드 등록 해제.
     *
     * @param spec 백엔드 스펙
     * @return 등록되어 있어 제거된 경우 true
     */
    public boolean unregister(BackendSpec spec) {
        lock.writeLock().lock();
        try {
            int index = indexOf(spec);
            if (index < 0) {
                return false;
            }
            Entry removed = entries.remove(index);
            invalidate();
            log.debug("Unregistered dispatcher backend {}", removed.name());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 모든 등록을 제거하고 초기 상태로 되돌림.
     *
     * <p>다음 해석 시 빌트인 백엔드가 다시 등록됩니다.</p>
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            seeded = false;
            invalidate();
            log.debug("Cleared dispatcher backends");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 현재 프로세스에서 사용할 백엔드 해석.
     *
     * @return 선택된 백엔드
     * @throws BackendResolutionException 사용 가능한 백엔드가 없는 경우
     */
    public DispatcherBackend resolve() {
        Resolution current = cached.get();
        if (current != null && current.generation() == generation.get()) {
            return current.backend();
        }

        ensureSeeded();
        long observed;
        List<Entry> snapshot;
        lock.readLock().lock();
        try {
            observed = generation.get();
            snapshot = List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }

        DispatcherBackend backend = resolveFrom(snapshot);
        if (generation.get() == observed) {
            cached.set(new Resolution(observed, backend));
        }
        return backend;
    }

    /**
     * 등록된 백엔드와 가용성 목록.
     *
     * <p>각 항목을 새로 생성하여 탐지합니다. 캐시는 변경하지 않습니다.</p>
     *
     * @return 우선순위 순 스냅샷
     */
    public List<BackendStatus> list() {
        List<BackendStatus> result = new ArrayList<>();
        for (Entry entry : snapshot()) {
            boolean available = probe(entry).isPresent();
            result.add(new BackendStatus(entry.priority(), entry.name(), available));
        }
        return result;
    }

    /**
     * 호스트(DCC) 애플리케이션 내부 실행 여부.
     *
     * @return 호스트 티어 백엔드 중 사용 가능한 것이 있으면 true
     */
    public boolean isHostEnvironment() {
        return currentHostName().isPresent();
    }

    /**
     * 현재 호스트 애플리케이션 이름.
     *
     * <p>호스트 티어({@link DispatcherPriority#HOST_THRESHOLD} 이상)만 우선순위 순으로 탐지하며,
     * 결과를 캐시하지 않습니다.</p>
     *
     * @return 호스트 이름 (호스트 외부이면 empty)
     */
    public Optional<String> currentHostName() {
        for (Entry entry : snapshot()) {
            if (!DispatcherPriority.isHostTier(entry.priority())) {
                continue;
            }
            Optional<DispatcherBackend> backend = probe(entry);
            if (backend.isPresent()) {
                log.debug("Host environment detected: {}", backend.get().getName());
                return Optional.of(backend.get().getName());
            }
        }
        return Optional.empty();
    }

    /**
     * 현재 목록 세대.
     *
     * @return 목록이 변경될 때마다 증가하는 값
     */
    public long generation() {
        return generation.get();
    }

    private DispatcherBackend resolveFrom(List<Entry> snapshot) {
        String forced = forcedBackendName();
        if (forced != null) {
            Optional<DispatcherBackend> selected = resolveForced(snapshot, forced);
            if (selected.isPresent()) {
                return selected.get();
            }
        }

        for (Entry entry : snapshot) {
            Optional<DispatcherBackend> backend = probe(entry);
            if (backend.isPresent()) {
                log.debug("Selected dispatcher backend: {} (priority={})", backend.get().getName(), entry.priority());
                return backend.get();
            }
        }

        List<String> names = snapshot.stream().map(Entry::name).toList();
        throw new BackendResolutionException("No main thread dispatcher backend available (registered: " + names + ")");
    }

    private Optional<DispatcherBackend> resolveForced(List<Entry> snapshot, String forced) {
        for (Entry entry : snapshot) {
            if (!entry.name().toLowerCase(Locale.ROOT).equals(forced)) {
                continue;
            }
            Optional<DispatcherBackend> backend = probe(entry);
            if (backend.isPresent()) {
                log.info("Using dispatcher backend from environment: {} (priority={})",
                    backend.get().getName(), entry.priority());
                return backend;
            }
            log.warn("Environment-specified backend '{}' is not available; falling back to priority order", forced);
            return Optional.empty();
        }
        log.warn("Environment-specified backend '{}' does not match any registered backend; "
            + "falling back to priority order", forced);
        return Optional.empty();
    }

    private String forcedBackendName() {
        String value = properties.get(config.backendProperty());
        if (value == null || value.isBlank()) {
            value = environment.get(config.backendEnvVar());
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 항목을 생성하고 가용성을 탐지.
     *
     * @return 생성에 성공하고 사용 가능한 경우 백엔드
     */
    private Optional<DispatcherBackend> probe(Entry entry) {
        try {
            Optional<DispatcherBackend> backend = entry.spec().instantiate();
            return backend.filter(DispatcherBackend::isAvailable);
        } catch (Exception | LinkageError e) {
            log.warn("Failed to initialize dispatcher backend {}: {}", entry.name(), e.toString(), e);
            return Optional.empty();
        }
    }

    private List<Entry> snapshot() {
        ensureSeeded();
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 빌트인 백엔드 최초 등록.
     *
     * <p>호출자가 이미 등록한 스펙은 덮어쓰지 않습니다.</p>
     */
    private void ensureSeeded() {
        lock.readLock().lock();
        try {
            if (seeded) {
                return;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (seeded) {
                return;
            }
            seeded = true;
            for (BuiltinBackend builtin : BuiltinBackend.values()) {
                BackendSpec spec = BackendSpec.of(builtin);
                if (indexOf(spec) < 0) {
                    register(spec, builtin.defaultPriority(), builtin.displayName());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int indexOf(BackendSpec spec) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).spec().equals(spec)) {
                return i;
            }
        }
        return -1;
    }

    private void invalidate() {
        generation.incrementAndGet();
        cached.set(null);
    }

    private record Entry(int priority, BackendSpec spec, String name, long sequence) {
    }

    private record Resolution(long generation, DispatcherBackend backend) {
    }
}
