package personal.cinema.core.admin.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.cinema.core.admin.adapter.in.web.dto.CatalogInitRequest;
import personal.cinema.core.admin.application.service.CatalogInitService;

import java.util.Map;

/**
 * Admin Catalog Controller
 *
 * WARNING: 개발/테스트 전용 API입니다.
 * 프로덕션 환경에서는 자동 비활성화됩니다. (@Profile("!prod"))
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/catalog")
@Profile("!prod")
@RequiredArgsConstructor
public class AdminCatalogController {

    private final CatalogInitService catalogInitService;

    /**
     * 상영관 좌석과 상영 일정 생성
     * POST /api/admin/catalog/init
     */
    @PostMapping("/init")
    public ResponseEntity<Map<String, Object>> initializeCatalog(@Valid @RequestBody CatalogInitRequest request) {
        log.info("Initializing catalog via API: screenId={}, showings={}",
                request.screenId(), request.showings().size());

        long startTime = System.currentTimeMillis();
        Map<String, Object> result = catalogInitService.initialize(request.toCommand());
        long duration = System.currentTimeMillis() - startTime;

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "success", true,
                "message", "Catalog initialized successfully",
                "duration_ms", duration,
                "data", result));
    }
}
