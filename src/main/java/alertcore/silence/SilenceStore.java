package alertcore.silence;

import java.util.List;

/**
 * 静默持久化接口 - 按id追加或替换，启动时加载
 */
public interface SilenceStore {
    /**
     * 加载全部静默记录
     */
    List<Silence> loadAll();

    /**
     * 保存静默记录，id相同则替换
     */
    void save(Silence silence);

    /**
     * 删除静默记录
     */
    void delete(String id);
}
