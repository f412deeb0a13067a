package alertcore.silence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于JSON文件的静默持久化，每次变更整体写临时文件后原子替换
 */
public class FileSilenceStore implements SilenceStore {
    private static final Logger logger = LoggerFactory.getLogger(FileSilenceStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Silence> records = new LinkedHashMap<>();

    public FileSilenceStore(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        readFile();
    }

    private void readFile() {
        if (!Files.exists(file)) {
            logger.info("静默文件不存在，将在首次写入时创建: {}", file);
            return;
        }
        try {
            List<Silence> loaded = objectMapper.readValue(file.toFile(), new TypeReference<List<Silence>>() {});
            for (Silence silence : loaded) {
                records.put(silence.getId(), silence);
            }
            logger.info("已加载 {} 条静默记录: {}", records.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("读取静默文件失败: " + file, e);
        }
    }

    @Override
    public synchronized List<Silence> loadAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized void save(Silence silence) {
        Silence previous = records.put(silence.getId(), silence);
        try {
            flush();
        } catch (IOException e) {
            // 写入失败时回滚内存状态
            if (previous == null) {
                records.remove(silence.getId());
            } else {
                records.put(silence.getId(), previous);
            }
            throw new UncheckedIOException("保存静默失败: " + silence.getId(), e);
        }
    }

    @Override
    public synchronized void delete(String id) {
        Silence previous = records.remove(id);
        if (previous == null) {
            return;
        }
        try {
            flush();
        } catch (IOException e) {
            records.put(id, previous);
            throw new UncheckedIOException("删除静默失败: " + id, e);
        }
    }

    private void flush() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), new ArrayList<>(records.values()));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
