package shippingquotes.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import shippingquotes.api.dto.QuoteResponse;
import shippingquotes.service.QuoteService;

@RestController
@RequestMapping("/api/shipping")
@CrossOrigin(origins = "*", allowedHeaders = "Content-Type", methods = { RequestMethod.POST, RequestMethod.OPTIONS })
public class QuoteController {
    private static final Logger log = LoggerFactory.getLogger(QuoteController.class);

    private final QuoteService service;

    public QuoteController(QuoteService service) {
        this.service = service;
    }

    /**
     * The body is taken raw so that malformed JSON degrades to an empty shipment
     * instead of a 400.
     */
    @PostMapping(value = "/quote", produces = MediaType.APPLICATION_JSON_VALUE)
    public QuoteResponse quote(
            @RequestBody(required = false) String body,
            @RequestParam(required = false) String only,
            @RequestParam(required = false) String demo) {
        log.debug("Quote request only={} demo={}", only, demo);
        return QuoteResponse.from(service.quote(body, only, "1".equals(demo)));
    }
}
