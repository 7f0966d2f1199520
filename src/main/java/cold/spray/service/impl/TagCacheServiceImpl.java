package cold.spray.service.impl;

import cold.spray.client.FeederClient;
import cold.spray.client.HardwareClient;
import cold.spray.client.PlcClient;
import cold.spray.configuration.CommunicationConfiguration;
import cold.spray.enums.Device;
import cold.spray.event.error.FeederErrorEvent;
import cold.spray.event.error.PlcPollErrorEvent;
import cold.spray.event.error.TagWriteErrorEvent;
import cold.spray.exception.HardwareException;
import cold.spray.exception.TagException;
import cold.spray.exception.TagNotCachedException;
import cold.spray.exception.UnknownTagException;
import cold.spray.exception.ValidationException;
import cold.spray.model.TagDefinition;
import cold.spray.model.TagMappingTable;
import cold.spray.model.TagValue;
import cold.spray.service.TagCacheService;
import cold.spray.service.TagMappingService;
import cold.spray.service.TagStateCallback;
import cold.spray.utils.TagConverter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

@Service
public class TagCacheServiceImpl implements TagCacheService {
    private static final Logger logger = LoggerFactory.getLogger(TagCacheServiceImpl.class);
    private final TagMappingService tagMappingService;
    private final PlcClient plcClient;
    private final FeederClient feederClient;
    private final CommunicationConfiguration configuration;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Environment environment;
    private final Map<String, TagValue> cache = new ConcurrentHashMap<>();
    private final List<TagStateCallback> callbacks = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ReentrantLock pollLock = new ReentrantLock();
    private final AtomicReference<Instant> lastTimestamp = new AtomicReference<>(Instant.EPOCH);
    private final AtomicInteger pollErrors = new AtomicInteger();
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean running;
    private volatile Instant initializedAt;

    public TagCacheServiceImpl(
            TagMappingService tagMappingService,
            PlcClient plcClient,
            FeederClient feederClient,
            CommunicationConfiguration configuration,
            ApplicationEventPublisher applicationEventPublisher,
            Environment environment,
            MeterRegistry meterRegistry
    ) {
        this.tagMappingService = tagMappingService;
        this.plcClient = plcClient;
        this.feederClient = feederClient;
        this.configuration = configuration;
        this.applicationEventPublisher = applicationEventPublisher;
        this.environment = environment;
        this.initializedAt = nextTimestamp();

        Gauge.builder("tag_cache", cache::size)
                .tag("component", "cached_tags")
                .tag("system", "cold_spray")
                .description("Количество тегов в кэше")
                .register(meterRegistry);

        Gauge.builder("tag_cache", pollErrors::get)
                .tag("component", "poll_errors")
                .tag("system", "cold_spray")
                .description("Количество ошибок опроса ПЛК")
                .register(meterRegistry);
    }

    @EventListener({ContextRefreshedEvent.class})
    public void init() {
        if (!environment.matchesProfiles("test")) {
            logger.debug("Подключение к оборудованию выполняем в фоне, чтобы не задерживать запуск приложения");
            scheduler.execute(this::connectAndStart);
        }
    }

    private void connectAndStart() {
        initialize();
        try {
            plcClient.connect();
        } catch (HardwareException e) {
            logger.error("Не удалось подключиться к ПЛК при запуске, опрос будет переподключаться: {}", e.getMessage());
            applicationEventPublisher.publishEvent(new PlcPollErrorEvent(this, e.getMessage()));
        }
        try {
            feederClient.connect();
        } catch (HardwareException e) {
            logger.error("Не удалось подключиться к контроллеру питателя, работаем без него: {}", e.getMessage());
            applicationEventPublisher.publishEvent(new FeederErrorEvent(this, "connect", e.getMessage()));
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
        plcClient.disconnect();
        feederClient.disconnect();
    }

    @Override
    public void initialize() {
        tagMappingService.rebuild();
        initializedAt = nextTimestamp();
        logger.info("Кэш тегов инициализирован");
    }

    @Override
    public synchronized void start() {
        if (running) {
            logger.warn("Опрос ПЛК уже запущен");
            return;
        }
        running = true;
        long interval = configuration.getPollInterval().toMillis();
        pollTask = scheduler.scheduleWithFixedDelay(this::pollIfRunning, 0, interval, TimeUnit.MILLISECONDS);
        logger.info("Опрос ПЛК запущен с интервалом {} мс", interval);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            logger.debug("Опрос ПЛК не запущен");
            return;
        }
        running = false;
        ScheduledFuture<?> task = pollTask;
        pollTask = null;
        if (task != null) {
            task.cancel(false);
        }
        /* дожидаемся завершения прохода, который уже начался */
        pollLock.lock();
        pollLock.unlock();
        logger.info("Опрос ПЛК остановлен");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public Instant getInitializedAt() {
        return initializedAt;
    }

    @Override
    public void clearCache() {
        cache.clear();
        logger.info("Кэш тегов очищен");
    }

    /* флаг проверяется под блокировкой, иначе проход может начаться уже после stop() */
    private void pollIfRunning() {
        pollLock.lock();
        try {
            if (running) {
                poll();
            }
        } finally {
            pollLock.unlock();
        }
    }

    private void poll() {
        pollLock.lock();
        try {
            logger.debug("Запущен опрос ПЛК");
            if (!plcClient.isConnected()) {
                logger.info("Нет подключения к ПЛК, подключаемся");
                plcClient.connect();
            }
            Map<String, Object> values = plcClient.readAllTags();
            TagMappingTable mappingTable = tagMappingService.getMappingTable();
            int updated = 0;
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                String mappedName = mappingTable.getMappedName(Device.PLC, entry.getKey());
                if (mappedName == null) {
                    /* служебные регистры ПЛК не сопоставлены с тегами */
                    continue;
                }
                TagDefinition definition = mappingTable.getDefinition(mappedName);
                try {
                    updateTag(definition, TagConverter.toEngineering(definition, entry.getValue()));
                    updated++;
                } catch (IllegalArgumentException | ClassCastException e) {
                    logger.warn("Не удалось перевести значение {} тега {}: {}",
                            entry.getValue(), definition.getPath(), e.getMessage());
                }
            }
            logger.debug("Опрос ПЛК завершен, обновлено тегов: {}", updated);
        } catch (HardwareException e) {
            pollErrors.incrementAndGet();
            logger.error("Ошибка опроса ПЛК: {}", e.getMessage());
            logger.debug("Отправляем событие об ошибке опроса ПЛК");
            applicationEventPublisher.publishEvent(new PlcPollErrorEvent(this, e.getMessage()));
        } catch (RuntimeException e) {
            pollErrors.incrementAndGet();
            logger.error("Непредвиденная ошибка опроса ПЛК", e);
            applicationEventPublisher.publishEvent(new PlcPollErrorEvent(this, String.valueOf(e.getMessage())));
        } finally {
            pollLock.unlock();
        }
    }

    private void updateTag(TagDefinition definition, Object value) {
        TagValue previous = cache.put(definition.getPath(), new TagValue(value, definition, nextTimestamp()));
        Object oldValue = previous != null ? previous.getValue() : null;
        if (!Objects.equals(oldValue, value)) {
            notifyCallbacks(definition.getPath(), oldValue, value);
        }
    }

    private void notifyCallbacks(String tag, Object oldValue, Object newValue) {
        for (TagStateCallback callback : callbacks) {
            try {
                callback.onTagChanged(tag, oldValue, newValue);
            } catch (RuntimeException e) {
                logger.error("Ошибка в подписчике на изменение тега {}", tag, e);
            }
        }
    }

    /* время строго возрастает, даже если системные часы стоят на месте или перевелись назад */
    private Instant nextTimestamp() {
        return lastTimestamp.updateAndGet(last -> {
            Instant now = Instant.now();
            return now.isAfter(last) ? now : last.plusNanos(1);
        });
    }

    @Override
    public Object getTag(String tag) throws TagNotCachedException {
        return getTagWithMetadata(tag).getValue();
    }

    @Override
    public TagValue getTagWithMetadata(String tag) throws TagNotCachedException {
        TagValue value = cache.get(tag);
        if (value == null) {
            throw new TagNotCachedException(tag);
        }
        return value;
    }

    @Override
    public Map<String, TagValue> getAllTags() {
        return new HashMap<>(cache);
    }

    @Override
    public Map<String, TagValue> getGroupTags(String group) {
        return cache.entrySet().stream()
                .filter(entry -> entry.getValue().getDefinition().getGroup().equals(group))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    @Override
    public void setTag(String tag, Object value) throws TagException, HardwareException {
        TagDefinition definition = tagMappingService.getTagMetadata(tag);
        if (!definition.isMapped()) {
            if (!definition.isInternal()) {
                throw new UnknownTagException(tag);
            }
            logger.debug("Внутренний тег {} = {}", tag, value);
            updateTag(definition, value);
            return;
        }

        validate(definition, value);
        String address = definition.getHardwareAddress();
        Object hardwareValue = TagConverter.toHardware(definition, value);
        HardwareClient client = definition.isPlcTag() ? plcClient : feederClient;

        try {
            client.writeTag(address, hardwareValue);
        } catch (HardwareException e) {
            logger.error("Не удалось записать {} = {} ({} = {}): {}", tag, value, address, hardwareValue, e.getMessage());
            logger.debug("Отправляем событие об ошибке записи тега");
            applicationEventPublisher.publishEvent(new TagWriteErrorEvent(this, tag, client.getDevice()));
            throw e;
        }

        logger.debug("Записали {} = {} ({} = {})", tag, value, address, hardwareValue);
        Object cachedValue = definition.hasSpeeds() && value instanceof String ? value : definition.getType().coerce(value);
        updateTag(definition, cachedValue);
    }

    @Override
    public void validateValue(String tag, Object value) throws TagException {
        validate(tagMappingService.getTagMetadata(tag), value);
    }

    private void validate(TagDefinition definition, Object value) throws ValidationException {
        String tag = definition.getPath();
        if (definition.isInternal()) {
            return;
        }
        if (!definition.isWritable()) {
            throw new ValidationException(tag, "Тег " + tag + " доступен только для чтения");
        }
        if (value == null) {
            throw new ValidationException(tag, "Пустое значение для тега " + tag);
        }
        if (definition.hasSpeeds() && value instanceof String) {
            if (!definition.getSpeeds().containsKey(value)) {
                throw new ValidationException(tag, "Неизвестная скорость " + value + " для тега " + tag
                        + ", допустимые: " + definition.getSpeeds().keySet());
            }
            return;
        }
        if (!definition.getType().accepts(value)) {
            throw new ValidationException(tag, "Тег " + tag + " ожидает " + definition.getType().getTemplate()
                    + ", получено " + value.getClass().getSimpleName());
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (definition.getRangeMin() != null && number < definition.getRangeMin()) {
                throw new ValidationException(tag, "Значение " + value + " тега " + tag
                        + " меньше минимума " + definition.getRangeMin());
            }
            if (definition.getRangeMax() != null && number > definition.getRangeMax()) {
                throw new ValidationException(tag, "Значение " + value + " тега " + tag
                        + " больше максимума " + definition.getRangeMax());
            }
        }
        if (!definition.getOptions().isEmpty() && !definition.getOptions().contains(value.toString())) {
            throw new ValidationException(tag, "Значение " + value + " тега " + tag
                    + " не входит в список " + definition.getOptions());
        }
    }

    @Override
    public void addStateCallback(TagStateCallback callback) {
        callbacks.add(callback);
    }

    @Override
    public void removeStateCallback(TagStateCallback callback) {
        callbacks.remove(callback);
    }
}
