package com.apitools.service.impl;

import com.apitools.model.ApiOperation;
import com.apitools.model.ApiParameter;
import com.apitools.model.ApiRequestBody;
import com.apitools.model.ApiSchema;
import com.apitools.model.ApiSpecification;
import com.apitools.model.Tool;
import com.apitools.model.ToolParameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCompilerImplTest {

    private final ToolCompilerImpl compiler = new ToolCompilerImpl();
    private final OperationExtractorImpl extractor = new OperationExtractorImpl(new SchemaResolver(), 10);

    private static ApiParameter query(String name, String type, String description) {
        return new ApiParameter(name, "query", false, type, null, null, null, null, description);
    }

    private static ApiOperation operation(String id, List<ApiParameter> parameters, ApiRequestBody body) {
        return new ApiOperation(id, "Summary", null, parameters, body, Map.of());
    }

    private static ApiRequestBody jsonBody(ApiSchema... properties) {
        ApiSchema root = new ApiSchema("inline", List.of("object"), null, List.of(properties), null, null, null);
        return new ApiRequestBody(false, "application/json", null, root, Map.of());
    }

    private static ToolParameter parameter(Tool tool, String name) {
        return tool.parameters().stream().filter(p -> p.name().equals(name)).findFirst().orElseThrow();
    }

    private static List<String> names(Tool tool) {
        return tool.parameters().stream().map(ToolParameter::name).collect(Collectors.toList());
    }

    private Tool compileFixture(String resource, String route, String method) {
        ApiSpecification specification = new ApiSpecification(
                extractor.extractPaths(OpenApiFixtures.read(resource), List.of(route)), List.of());
        ApiOperation operation = specification.paths().get(0).operations().get(method);
        return compiler.compile(operation, method, specification.paths().get(0).path(), List.of());
    }

    @Test
    void normalize_shouldProduceSnakeCaseIdentifiers() {
        assertThat(ToolNames.normalize("getUserById")).isEqualTo("get_user_by_id");
        assertThat(ToolNames.normalize("X-Trace-Id")).isEqualTo("x_trace_id");
        assertThat(ToolNames.normalize("/apod")).isEqualTo("apod");
        assertThat(ToolNames.normalize("created[gte]")).isEqualTo("created_gte");
        assertThat(ToolNames.normalize("expand[]")).isEqualTo("expands");
        assertThat(ToolNames.normalize("__odd__name__")).isEqualTo("odd_name");
    }

    @Test
    void sanitize_shouldFlattenNewlinesAndQuotes() {
        assertThat(ToolNames.sanitize("Line one\nLine \"two\"\r\n")).isEqualTo("Line one Line 'two'");
        assertThat(ToolNames.sanitize("“curly” ‘quotes’")).isEqualTo("'curly' 'quotes'");
        assertThat(ToolNames.sanitize(null)).isEmpty();
    }

    @Test
    void compile_shouldMapPrimitiveTypes() {
        ApiParameter tags = new ApiParameter("tags", "query", false, "array", "integer", null, null, null, null);
        ApiParameter either = new ApiParameter("either", "query", false, null, null,
                List.of("string", "object"), null, null, null);
        Tool tool = compiler.compile(operation("types", List.of(
                query("s", "string", null), query("i", "integer", null), query("n", "number", null),
                query("b", "boolean", null), query("o", "object", null), tags, either), null), "GET", "/t", List.of());

        assertThat(parameter(tool, "s").type()).isEqualTo("string");
        assertThat(parameter(tool, "i").type()).isEqualTo("integer");
        assertThat(parameter(tool, "n").type()).isEqualTo("float");
        assertThat(parameter(tool, "b").type()).isEqualTo("bool");
        assertThat(parameter(tool, "o").type()).isEqualTo("string");
        assertThat(parameter(tool, "tags").type()).isEqualTo("list[integer]");
        assertThat(parameter(tool, "either").type()).isEqualTo("union[string, any]");
    }

    @Test
    void compile_shouldOrderParametersInReverseLexicographicOrder() {
        Tool tool = compiler.compile(operation("order", List.of(
                query("beta", "string", null), query("alpha", "string", null), query("gamma", "string", null)),
                null), "GET", "/o", List.of());

        assertThat(names(tool)).containsExactly("gamma", "beta", "alpha");
    }

    @Test
    void compile_shouldKeepOnlyFirstOfCollidingNames() {
        Tool tool = compiler.compile(operation("dedup", List.of(
                query("foo", "string", "plain"),
                new ApiParameter("foo[]", "query", false, "array", "string", null, null, null, "list")),
                null), "GET", "/d", List.of());

        assertThat(tool.parameters()).hasSize(1);
        ToolParameter foos = tool.parameters().get(0);
        assertThat(foos.name()).isEqualTo("foos");
        assertThat(foos.type()).isEqualTo("list[string]");
        assertThat(foos.sourceName()).isEqualTo("foo[]");
    }

    @Test
    void compile_shouldSkipExcludedParametersByRawOrNormalizedName() {
        Tool tool = compiler.compile(operation("excluded", List.of(
                query("appid", "string", null), query("X-Api-Key", "string", null), query("q", "string", null)),
                null), "GET", "/e", List.of("appid", "x_api_key"));

        assertThat(names(tool)).containsExactly("q");
    }

    @Test
    void compile_shouldAppendEnumOptionsWithinBudget() {
        ApiParameter unit = new ApiParameter("unit", "query", false, "string", null, null,
                List.of("celsius", "fahrenheit"), "celsius", "Temperature unit");

        Tool tool = compiler.compile(operation("enum", List.of(unit), null), "GET", "/u", List.of());

        ToolParameter converted = tool.parameters().get(0);
        assertThat(converted.description()).isEqualTo("Temperature unit Options: celsius, fahrenheit");
        assertThat(converted.defaultValue()).isEqualTo("celsius");
        assertThat(converted.required()).isTrue();
    }

    @Test
    void compile_shouldTruncateLongEnumOptions() {
        List<Object> values = IntStream.range(0, 30).mapToObj(i -> (Object) ("option_value_" + i))
                .collect(Collectors.toList());
        ApiParameter sort = new ApiParameter("sort", "query", false, "string", null, null, values, null, "Sort order");

        Tool tool = compiler.compile(operation("long", List.of(sort), null), "GET", "/l", List.of());

        assertThat(tool.parameters().get(0).description())
                .isEqualTo("Sort order Options: option_value_0, option_value_1, ...");
    }

    @Test
    void compile_shouldDescribeToolFromSummaryThenDescription() {
        ApiOperation withDescription = new ApiOperation("op", "", "First line\nsecond \"line\"", List.of(), null,
                Map.of());
        ApiOperation bare = new ApiOperation("op", null, null, List.of(), null, Map.of());

        assertThat(compiler.compile(withDescription, "GET", "/", List.of()).description())
                .isEqualTo("First line second 'line'");
        assertThat(compiler.compile(bare, "GET", "/", List.of()).description()).isEmpty();
    }

    @Test
    void compile_shouldFlattenScalarAndArrayBodyFields() {
        Tool tool = compiler.compile(operation("createThing", List.of(), jsonBody(
                ApiSchema.leaf("title", "string", "Title"),
                new ApiSchema("labels", List.of("array"), null, List.of(), ApiSchema.leaf("item", "string", null),
                        null, null),
                new ApiSchema("nested", List.of("object"), null, List.of(ApiSchema.leaf("x", "string", null)),
                        null, null, null))), "POST", "/things", List.of());

        assertThat(names(tool)).containsExactly("title", "labels");
        assertThat(parameter(tool, "labels").type()).isEqualTo("list[string]");
        assertThat(parameter(tool, "title").requestBodyField()).isEqualTo("title");
        assertThat(parameter(tool, "title").location()).isEqualTo("body");
        assertThat(tool.bodyContentType()).isEqualTo("application/json");
    }

    @Test
    void compile_shouldDropBodyFieldsCollidingWithParameters() {
        Tool tool = compiler.compile(operation("collide", List.of(query("title", "string", "query title")),
                jsonBody(ApiSchema.leaf("title", "string", "body title"))), "POST", "/c", List.of());

        assertThat(tool.parameters()).hasSize(1);
        assertThat(tool.parameters().get(0).location()).isEqualTo("query");
        assertThat(tool.bodyContentType()).isNull();
    }

    @Test
    void compile_shouldDescribeAnyOfAlternatives() {
        ApiSchema objectBranch = new ApiSchema("Card", List.of("object"), null,
                List.of(ApiSchema.leaf("number", "string", null), ApiSchema.leaf("cvc", "string", null)),
                null, null, null);
        ApiSchema stringBranch = ApiSchema.leaf("inline", "string", "A token");
        ApiSchema source = new ApiSchema("source", List.of("object", "string"), "Payment source",
                objectBranch.properties(), null, List.of(objectBranch, stringBranch), null);
        ApiSchema undocumented = new ApiSchema("other", List.of("object", "string"), null, List.of(), null,
                List.of(objectBranch, ApiSchema.leaf("inline", "string", null)), null);

        Tool tool = compiler.compile(operation("pay", List.of(), jsonBody(source, undocumented)), "POST", "/pay",
                List.of());

        ToolParameter converted = parameter(tool, "source");
        assertThat(converted.type()).isEqualTo("union[any, string]");
        assertThat(converted.description())
                .isEqualTo("Payment source, one of: (Object with properties: number, cvc) OR (A token)");
        assertThat(converted.requestBodyField()).isEqualTo("source");
        assertThat(parameter(tool, "other").description())
                .isEqualTo("one of: (Object with properties: number, cvc) OR (string)");
    }

    @Test
    void compile_shouldExpandAllOfLeavesWithDottedFields() {
        ApiSchema base = new ApiSchema("Base", List.of("object"), null,
                List.of(ApiSchema.leaf("street", "string", "Street")), null, null, null);
        ApiSchema extra = new ApiSchema("inline", List.of("object"), null,
                List.of(ApiSchema.leaf("zip", "integer", null)), null, null, null);
        ApiSchema address = new ApiSchema("homeAddress", List.of("object"), null,
                List.of(ApiSchema.leaf("street", "string", "Street"), ApiSchema.leaf("zip", "integer", null)),
                null, null, List.of(base, extra));

        Tool tool = compiler.compile(operation("move", List.of(), jsonBody(address)), "PUT", "/move", List.of());

        assertThat(names(tool)).containsExactly("home_address_street", "home_address_zip");
        assertThat(parameter(tool, "home_address_street").requestBodyField()).isEqualTo("homeAddress.street");
        assertThat(parameter(tool, "home_address_zip").type()).isEqualTo("integer");
    }

    @Test
    void compile_shouldBeDeterministic() {
        ApiOperation operation = operation("same", List.of(
                query("b", "string", "B"), query("a", "integer", "A")),
                jsonBody(ApiSchema.leaf("c", "boolean", "C")));

        Tool first = compiler.compile(operation, "POST", "/same", new ArrayList<>(List.of("z")));
        Tool second = compiler.compile(operation, "POST", "/same", List.of("z"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void compile_shouldBuildForecastToolFromWeatherDocument() {
        Tool tool = compileFixture("openapi/weather.yaml", "/v1/forecast", "GET");

        assertThat(tool.name()).isEqualTo("get_forecast");
        assertThat(tool.description()).isEqualTo("Get weather forecast");
        assertThat(names(tool)).containsExactly("wind_speed_unit", "timezone", "timeformat", "temperature_unit",
                "longitude", "latitude", "hourly", "forecast_days");

        ToolParameter temperature = parameter(tool, "temperature_unit");
        assertThat(temperature.type()).isEqualTo("string");
        assertThat(temperature.defaultValue()).isEqualTo("celsius");
        assertThat(temperature.description()).isEqualTo("Temperature unit Options: celsius, fahrenheit");
        assertThat(parameter(tool, "wind_speed_unit").description())
                .isEqualTo("Wind speed unit Options: kmh, ms, mph, kn");
        assertThat(parameter(tool, "timeformat").description()).isEqualTo("Time format Options: iso8601, unixtime");
        assertThat(parameter(tool, "timeformat").defaultValue()).isEqualTo("iso8601");
        assertThat(parameter(tool, "timezone").description()).endsWith("Options: GMT, auto, ...");
        assertThat(parameter(tool, "latitude").type()).isEqualTo("float");
        assertThat(parameter(tool, "latitude").required()).isTrue();
        assertThat(parameter(tool, "hourly").type()).isEqualTo("list[string]");
        assertThat(parameter(tool, "hourly").required()).isFalse();
        assertThat(parameter(tool, "forecast_days").defaultValue()).hasToString("7");
    }

    @Test
    void compile_shouldBuildFormToolFromCustomerDocument() {
        Tool tool = compileFixture("openapi/customers.json", "/v1/customers$", "POST");

        assertThat(tool.name()).isEqualTo("post_customers");
        assertThat(tool.bodyContentType()).isEqualTo("application/x-www-form-urlencoded");
        assertThat(names(tool)).containsExactly("name", "email", "address", "metadata", "shipping_name",
                "shipping_phone", "shipping_carrier", "preferred_locales", "expand");

        ToolParameter address = parameter(tool, "address");
        assertThat(address.type()).isEqualTo("union[any, string]");
        assertThat(address.description()).isEqualTo("The customer's address., one of: "
                + "(Object with properties: city, country, line1, postal_code) OR (string)");

        assertThat(parameter(tool, "metadata").type()).isEqualTo("union[any, string]");
        assertThat(parameter(tool, "shipping_carrier").requestBodyField()).isEqualTo("shipping.carrier");
        assertThat(parameter(tool, "shipping_name").description()).isEqualTo("Recipient name.");
        assertThat(parameter(tool, "preferred_locales").type()).isEqualTo("list[string]");
    }

    @Test
    void compile_shouldDeduplicateListParametersFromCustomerDocument() {
        Tool tool = compileFixture("openapi/customers.json", "/v1/customers$", "GET");

        assertThat(tool.name()).isEqualTo("get_customers");
        assertThat(names(tool)).containsExactly("starting_after", "limit", "expands", "email", "created");
        assertThat(parameter(tool, "expands").sourceName()).isEqualTo("expand[]");
        assertThat(parameter(tool, "expands").type()).isEqualTo("list[string]");
    }

    @Test
    void compile_shouldTypeAnyOfQueryParameterAsUnion() {
        Tool tool = compileFixture("openapi/customers.json", "/v1/customers$", "GET");

        ToolParameter created = parameter(tool, "created");
        assertThat(created.type()).isEqualTo("union[any, integer]");
        assertThat(created.location()).isEqualTo("query");
    }

    @Test
    void queryParameters_shouldListEveryNonBodyParameter() {
        Tool tool = compileFixture("openapi/customers.json", "/v1/customers$", "GET");

        assertThat(tool.queryParameters()).extracting(ToolParameter::name)
                .containsExactly("starting_after", "limit", "expands", "email", "created");
        assertThat(tool.bodyParametersByContentType()).isEmpty();
    }

    @Test
    void bodyParametersByContentType_shouldGroupBodyFieldsUnderFormContentType() {
        Tool tool = compileFixture("openapi/customers.json", "/v1/customers$", "POST");

        assertThat(tool.queryParameters()).isEmpty();
        assertThat(tool.bodyParametersByContentType()).containsOnlyKeys("application/x-www-form-urlencoded");
        assertThat(tool.bodyParametersByContentType().get("application/x-www-form-urlencoded"))
                .extracting(ToolParameter::name)
                .containsExactly("name", "email", "address", "metadata", "shipping_name",
                        "shipping_phone", "shipping_carrier", "preferred_locales", "expand");
    }

    @Test
    void compileAll_shouldCompileEveryOperationInOrder() {
        ApiSpecification specification = new ApiSpecification(
                extractor.extractPaths(OpenApiFixtures.read("openapi/users.yaml"), List.of("/api/v1/users")),
                List.of());

        List<Tool> tools = compiler.compileAll(specification, List.of("X-Trace-Id"));

        assertThat(tools).extracting(Tool::name).containsExactly(
                "list_users", "create_user", "get_user", "delete_user", "api_v1_users_user_id_avatar");
        assertThat(tools.get(0).parameters()).extracting(ToolParameter::name)
                .containsExactly("tags", "status", "limit");
        assertThat(tools.get(1).parameters()).extracting(ToolParameter::name)
                .containsExactly("name", "email", "age", "score", "active", "nicknames", "role");
        assertThat(tools.get(1).parameters()).extracting(ToolParameter::type)
                .containsExactly("string", "string", "integer", "float", "bool", "list[string]", "string");
        assertThat(tools.get(2).description()).isEqualTo("Fetch a single user by 'id'.");
        assertThat(tools.get(4).method()).isEqualTo("PUT");
        assertThat(tools.get(4).path()).isEqualTo("/api/v1/users/{userId}/avatar");
    }
}
