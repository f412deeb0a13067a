package alertcore.silence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存实现，未配置持久化路径时使用，进程重启后静默丢失
 */
public class InMemorySilenceStore implements SilenceStore {
    private final Map<String, Silence> silences = new ConcurrentHashMap<>();

    @Override
    public List<Silence> loadAll() {
        return new ArrayList<>(silences.values());
    }

    @Override
    public void save(Silence silence) {
        silences.put(silence.getId(), silence);
    }

    @Override
    public void delete(String id) {
        silences.remove(id);
    }
}
