package io.droplite.server.relayer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.droplite.core.Category;
import io.droplite.core.RewardEntry;
import io.droplite.server.dto.RewardEntryJson;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Reads scored rewards from {@code <dir>/<day>/<CATEGORY>.json}, a JSON array of
 * {@code {"user": "0x..", "points": 10, "reward": "500000000000000000"}}.
 * A missing file means no rewards for that slot.
 */
public final class JsonFileRewardSource implements RewardSource {

    private final Path dir;
    private final ObjectMapper json = new ObjectMapper();

    public JsonFileRewardSource(Path dir) {
        this.dir = dir;
    }

    @Override
    public List<RewardEntry> rewards(long day, Category category) {
        Path file = dir.resolve(Long.toString(day)).resolve(category.name() + ".json");
        if (!Files.exists(file)) return List.of();
        try {
            RewardEntryJson[] rows = json.readValue(file.toFile(), RewardEntryJson[].class);
            return Arrays.stream(rows)
                    .map(r -> new RewardEntry(r.user, r.points, new BigInteger(r.reward)))
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read rewards from " + file, e);
        }
    }
}
