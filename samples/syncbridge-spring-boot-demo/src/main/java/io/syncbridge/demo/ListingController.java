package io.syncbridge.demo;

import io.syncbridge.ChangeCapture;
import io.syncbridge.model.Operation;

import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
public class ListingController {

    private final JdbcTemplate jdbcTemplate;
    private final ChangeCapture changeCapture;

    public ListingController(JdbcTemplate jdbcTemplate, ChangeCapture changeCapture) {
        this.jdbcTemplate = jdbcTemplate;
        this.changeCapture = changeCapture;
    }

    @PostMapping("/listings")
    @Transactional
    public Map<String, Object> create(@RequestParam String title, @RequestParam BigDecimal price) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        jdbcTemplate.update("INSERT INTO listings (id, title, price, owner_note) VALUES (?, ?, ?, ?)",
                id, title, price, "internal");

        // Captured in the same transaction as the insert
        String queueId = changeCapture.enqueueSync("listings", id, Operation.INSERT, row(id)).orElse(null);
        return Map.of("status", "ok", "listingId", id, "queueId", String.valueOf(queueId));
    }

    @PutMapping("/listings/{id}")
    @Transactional
    public Map<String, Object> update(@PathVariable String id, @RequestParam BigDecimal price) {
        if (jdbcTemplate.update("UPDATE listings SET price = ? WHERE id = ?", price, id) == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No listing " + id);
        }
        String queueId = changeCapture.enqueueSync("listings", id, Operation.UPDATE, row(id)).orElse(null);
        return Map.of("status", "ok", "listingId", id, "queueId", String.valueOf(queueId));
    }

    @DeleteMapping("/listings/{id}")
    @Transactional
    public Map<String, Object> delete(@PathVariable String id) {
        Map<String, Object> snapshot = row(id);
        jdbcTemplate.update("DELETE FROM listings WHERE id = ?", id);
        String queueId = changeCapture.enqueueSync("listings", id, Operation.DELETE, snapshot).orElse(null);
        return Map.of("status", "ok", "listingId", id, "queueId", String.valueOf(queueId));
    }

    @GetMapping("/sync-queue")
    public List<Map<String, Object>> queue() {
        return jdbcTemplate.queryForList(
                "SELECT id, table_name, record_id, operation, status, retry_count, error_message, created_at "
                        + "FROM sync_queue ORDER BY created_at DESC LIMIT 50");
    }

    private Map<String, Object> row(String id) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT id, title, price, owner_note FROM listings WHERE id = ?", id);
        if (rows.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No listing " + id);
        }
        return rows.get(0);
    }
}
