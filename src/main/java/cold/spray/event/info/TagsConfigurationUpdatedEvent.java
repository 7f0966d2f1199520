package cold.spray.event.info;

import org.jetbrains.annotations.Nullable;
import org.springframework.context.ApplicationEvent;

import java.util.Map;

/* Без документа - перечитать конфигурацию тегов из файла */
public class TagsConfigurationUpdatedEvent extends ApplicationEvent {
    Map<String, Object> tagConfig;

    public TagsConfigurationUpdatedEvent(Object source, @Nullable Map<String, Object> tagConfig) {
        super(source);
        this.tagConfig = tagConfig;
    }

    @Nullable
    public Map<String, Object> getTagConfig() {
        return tagConfig;
    }
}
