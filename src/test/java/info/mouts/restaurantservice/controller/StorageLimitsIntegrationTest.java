package info.mouts.restaurantservice.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.jayway.jsonpath.JsonPath;

import info.mouts.restaurantservice.repository.FoodItemRepository;
import info.mouts.restaurantservice.repository.OrderRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs the full stack against H2: values the validators accept must also fit
 * the columns they are stored in, and values that do not fit must come back
 * as 400 problems with nothing stored.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Storage limits (full stack)")
public class StorageLimitsIntegrationTest {
    private static final String MENU_URL = "/api/v1/menu";
    private static final String ORDERS_URL = "/api/v1/orders";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private FoodItemRepository foodItemRepository;

    @BeforeEach
    void setUp() {
        orderRepository.deleteAll();
        foodItemRepository.deleteAll();
    }

    private String saladJson(String ingredient) {
        return "{"
                + "\"name\":\"Caesar Salad\","
                + "\"description\":\"Romaine lettuce with parmesan and croutons\","
                + "\"category\":\"salad\","
                + "\"price\":12.50,"
                + "\"preparationTime\":10,"
                + "\"ingredients\":[\"romaine\",\"" + ingredient + "\"],"
                + "\"calories\":350,"
                + "\"vegetarian\":true"
                + "}";
    }

    private long createSalad() throws Exception {
        String body = mockMvc.perform(post(MENU_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(saladJson("parmesan")))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return ((Number) JsonPath.read(body, "$.id")).longValue();
    }

    private String orderJson(long menuItemId, String deliveryFee) {
        return "{"
                + "\"customer\":{\"name\":\"Jane Doe\",\"phone\":\"5551234567\"},"
                + "\"items\":[{\"menuItemId\":" + menuItemId
                + ",\"menuItemName\":\"Caesar Salad\",\"quantity\":1,\"unitPrice\":12.50}],"
                + "\"deliveryFee\":" + deliveryFee
                + "}";
    }

    @Test
    void deliveryFeeAtColumnLimit_shouldBeStored() throws Exception {
        long saladId = createSalad();

        mockMvc.perform(post(ORDERS_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(orderJson(saladId, "9999.99")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.deliveryFee").value(9999.99));

        assertThat(orderRepository.count()).isEqualTo(1);
    }

    @Test
    void deliveryFeeBeyondColumnLimit_shouldReturnBadRequest() throws Exception {
        long saladId = createSalad();

        mockMvc.perform(post(ORDERS_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(orderJson(saladId, "10000.00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.violations[0].field").value("deliveryFee"))
                .andExpect(jsonPath("$.violations[0].rule").value("digits"));

        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void overlongIngredient_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post(MENU_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(saladJson("a".repeat(300))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.violations[0].field").value("ingredients"))
                .andExpect(jsonPath("$.violations[0].rule").value("ingredient_length"));

        assertThat(foodItemRepository.count()).isZero();
    }

    @Test
    void ingredientAtColumnLimit_shouldBeStored() throws Exception {
        mockMvc.perform(post(MENU_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(saladJson("a".repeat(255))))
                .andExpect(status().isCreated());

        assertThat(foodItemRepository.count()).isEqualTo(1);
    }
}
