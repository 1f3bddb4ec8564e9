package de.htwsaar.streamrelay.relay.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CorsHeaderFilterTest {

    private final CorsHeaderFilter filter = new CorsHeaderFilter();

    @Test
    void getPassesThroughWithCorsHeaders() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stream");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals("*", response.getHeader("Access-Control-Allow-Origin"));
        assertEquals("*", response.getHeader("Access-Control-Allow-Headers"));
        assertEquals("cross-origin", response.getHeader("Cross-Origin-Resource-Policy"));
        assertEquals(CorsHeaderFilter.EXPOSED_HEADERS, response.getHeader("Access-Control-Expose-Headers"));
        assertNull(response.getHeader("Access-Control-Max-Age"));
    }

    @Test
    void optionsIsAnsweredWithoutCallingChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/stream");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNull(chain.getRequest());
        assertEquals(204, response.getStatus());
        assertEquals("86400", response.getHeader("Access-Control-Max-Age"));
    }
}
