package personal.cinema.core.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.application.port.out.BookingHistoryRepository;
import personal.cinema.core.booking.domain.model.BookingHistory;

import java.util.List;
import java.util.Map;

/**
 * Booking History Persistence Adapter
 * metadata는 JSON 문자열로 저장한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingHistoryPersistenceAdapter implements BookingHistoryRepository {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JpaBookingHistoryRepository jpaBookingHistoryRepository;
    private final JpaBookingRepository jpaBookingRepository;
    private final ObjectMapper objectMapper;

    @Override
    public BookingHistory save(BookingHistory history) {
        log.debug("Appending booking history: bookingId={}, action={}", history.bookingId(), history.action());

        BookingHistoryEntity entity = BookingHistoryEntity.create(
                jpaBookingRepository.getReferenceById(history.bookingId()),
                history.action(),
                history.actor(),
                history.occurredAt(),
                writeMetadata(history.metadata()));

        BookingHistoryEntity saved = jpaBookingHistoryRepository.save(entity);
        return toDomain(saved, history.bookingId());
    }

    @Override
    public List<BookingHistory> findByBookingId(Long bookingId) {
        return jpaBookingHistoryRepository.findByBookingId(bookingId).stream()
                .map(entity -> toDomain(entity, bookingId))
                .toList();
    }

    private BookingHistory toDomain(BookingHistoryEntity entity, Long bookingId) {
        return new BookingHistory(entity.getId(), bookingId, entity.getAction(), entity.getActor(),
                entity.getOccurredAt(), readMetadata(entity.getMetadata()));
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize history metadata", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize history metadata");
        }
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize history metadata: {}", json, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to read history metadata");
        }
    }
}
