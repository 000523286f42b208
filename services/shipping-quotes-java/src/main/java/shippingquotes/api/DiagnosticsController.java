package shippingquotes.api;

import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import shippingquotes.service.DiagnosticsService;

@RestController
public class DiagnosticsController {

    private final DiagnosticsService diagnostics;

    public DiagnosticsController(DiagnosticsService diagnostics) {
        this.diagnostics = diagnostics;
    }

    @GetMapping("/api/diag")
    public Map<String, Object> diag() {
        return diagnostics.run();
    }
}
