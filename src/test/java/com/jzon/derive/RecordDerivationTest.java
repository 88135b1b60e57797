package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.exceptions.JsonDecodeException;
import com.jzon.exceptions.JsonDerivationException;
import com.jzon.json.JsonNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RecordDerivationTest {

    enum Priority { LOW, HIGH }

    record Address(String street, Optional<String> unit) {}

    record User(@JsonField("full_name") String name, int age, List<String> tags, Optional<Address> address) {}

    record Task(String title, Priority priority, Set<Integer> labels, Map<String, BigDecimal> costs, boolean done, JsonNode extra) {}

    @JsonDiscriminator("kind")
    sealed interface Shape permits Circle, Rect, Dot {}

    record Circle(double radius) implements Shape {}

    @JsonHint("rectangle")
    record Rect(double width, double height) implements Shape {}

    record Dot() implements Shape {}

    sealed interface Event permits Created, Deleted {}

    record Created(String id) implements Event {}

    record Deleted(String id, long at) implements Event {}

    record Tree(String label, List<Tree> children) {}

    @JsonNoExtraFields
    record Point(int x, int y) {}

    record Drawing(String name, List<Shape> shapes, Optional<Event> lastEvent) {}

    record Bad(Date when) {}

    record Outer(String name, Bad bad) {}

    @JsonDiscriminator("type")
    sealed interface Strict permits StrictVariant {}

    @JsonNoExtraFields
    record StrictVariant(int n) implements Strict {}

    record Named(String name, Integer count, JsonNode note) {}

    @JsonDiscriminator("type")
    sealed interface Vehicle permits Bike, Motor {}

    record Bike(int gears) implements Vehicle {}

    @JsonDiscriminator("engine")
    sealed interface Motor extends Vehicle permits Petrol, Electric {}

    record Petrol(int cylinders) implements Motor {}

    record Electric(int kwh) implements Motor {}

    @JsonDiscriminator("type")
    sealed interface Animal permits Cat, Canine {}

    record Cat(String name) implements Animal {}

    sealed interface Canine extends Animal permits Dog {}

    record Dog(String name) implements Canine {}

    @JsonDiscriminator("type")
    sealed interface Plant permits Oak, Flower {}

    record Oak(int height) implements Plant {}

    @JsonDiscriminator("type")
    sealed interface Flower extends Plant permits Rose {}

    record Rose(String colour) implements Flower {}

    @Test
    public void testRecord() {
        JsonCodec<User> codec = RecordDerivation.codec(User.class);
        User user = new User("Ada", 36, List.of("math", "engines"), Optional.empty());

        String json = codec.toJson(user);
        assertEquals("{\"full_name\":\"Ada\",\"age\":36,\"tags\":[\"math\",\"engines\"]}", json);
        assertEquals(user, codec.decode(json));
    }

    @Test
    public void testNestedRecord() {
        JsonCodec<User> codec = RecordDerivation.codec(User.class);
        User user = codec.decode("{\"full_name\":\"Ada\",\"age\":36,\"tags\":[],\"address\":{\"street\":\"Main\"}}");

        assertEquals(new User("Ada", 36, List.of(), Optional.of(new Address("Main", Optional.empty()))), user);
        assertEquals("{\"full_name\":\"Ada\",\"age\":36,\"tags\":[],\"address\":{\"street\":\"Main\"}}", codec.toJson(user));
    }

    @Test
    public void testComponentTypes() {
        JsonCodec<Task> codec = RecordDerivation.codec(Task.class);
        Task task = codec.decode("{\"title\":\"t\",\"priority\":\"HIGH\",\"labels\":[3,3],\"costs\":{\"a\":1.50},\"done\":true,\"extra\":{\"x\":[null]}}");

        assertEquals(Priority.HIGH, task.priority());
        assertEquals(Set.of(3), task.labels());
        assertEquals(Map.of("a", new BigDecimal("1.50")), task.costs());
        assertTrue(task.done());
        assertEquals(JsonNode.parse("{\"x\":[null]}"), task.extra());
        assertEquals("{\"title\":\"t\",\"priority\":\"HIGH\",\"labels\":[3],\"costs\":{\"a\":1.50},\"done\":true,\"extra\":{\"x\":[null]}}",
            codec.toJson(task));
    }

    @Test
    public void testDecodeErrorsNameTheComponent() {
        JsonCodec<Task> codec = RecordDerivation.codec(Task.class);
        JsonDecodeException e = assertThrows(JsonDecodeException.class, () -> codec.decode(
            "{\"title\":\"t\",\"priority\":\"MEDIUM\",\"labels\":[],\"costs\":{},\"done\":false,\"extra\":null}"));
        assertEquals(".priority(invalid enumeration value 'MEDIUM')", e.getMessage());
    }

    @Test
    public void testRenamedComponentUsesJsonName() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
            () -> RecordDerivation.decoder(User.class).decode("{\"name\":\"Ada\",\"age\":1,\"tags\":[]}"));
        assertEquals(".full_name(missing)", e.getMessage());
    }

    @Test
    public void testDiscriminatedSealedInterface() {
        JsonCodec<Shape> codec = RecordDerivation.codec(Shape.class);

        assertEquals("{\"kind\":\"Circle\",\"radius\":1.5}", codec.toJson(new Circle(1.5)));
        assertEquals("{\"kind\":\"rectangle\",\"width\":2.0,\"height\":3.0}", codec.toJson(new Rect(2, 3)));
        assertEquals("{\"kind\":\"Dot\"}", codec.toJson(new Dot()));
        assertEquals(new Rect(2, 3), codec.decode("{\"height\":3,\"kind\":\"rectangle\",\"width\":2}"));
        assertEquals(new Dot(), codec.decode("{\"kind\":\"Dot\"}"));
    }

    @Test
    public void testWrappedSealedInterface() {
        JsonCodec<Event> codec = RecordDerivation.codec(Event.class);

        assertEquals("{\"Deleted\":{\"id\":\"e1\",\"at\":99}}", codec.toJson(new Deleted("e1", 99)));
        assertEquals(new Created("e2"), codec.decode("{\"Created\":{\"id\":\"e2\"}}"));
    }

    @Test
    public void testSumsInsideRecords() {
        JsonCodec<Drawing> codec = RecordDerivation.codec(Drawing.class);
        Drawing drawing = new Drawing("d", List.of(new Dot(), new Circle(1)), Optional.of(new Created("c")));

        String json = codec.toJson(drawing);
        assertEquals("{\"name\":\"d\",\"shapes\":[{\"kind\":\"Dot\"},{\"kind\":\"Circle\",\"radius\":1.0}],\"lastEvent\":{\"Created\":{\"id\":\"c\"}}}", json);
        assertEquals(drawing, codec.decode(json));
    }

    @Test
    public void testRecursiveRecord() {
        JsonCodec<Tree> codec = RecordDerivation.codec(Tree.class);
        Tree tree = new Tree("a", List.of(new Tree("b", List.of()), new Tree("c", List.of(new Tree("d", List.of())))));

        String json = codec.toJson(tree);
        assertEquals("{\"label\":\"a\",\"children\":[{\"label\":\"b\",\"children\":[]},{\"label\":\"c\",\"children\":[{\"label\":\"d\",\"children\":[]}]}]}", json);
        assertEquals(tree, codec.decode(json));
    }

    @Test
    public void testNoExtraFields() {
        JsonCodec<Point> codec = RecordDerivation.codec(Point.class);

        assertEquals(new Point(1, 2), codec.decode("{\"x\":1,\"y\":2}"));
        JsonDecodeException e = assertThrows(JsonDecodeException.class, () -> codec.decode("{\"x\":1,\"y\":2,\"z\":3}"));
        assertEquals(".z(invalid extra field)", e.getMessage());
    }

    @Test
    public void testCodecsAreCached() {
        assertSame(RecordDerivation.codec(Point.class), RecordDerivation.codec(Point.class));
    }

    @Test
    public void testUnsupportedComponentType() {
        JsonDerivationException e = assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(Bad.class));
        assertEquals("Unsupported type java.util.Date for Bad.when", e.getMessage());

        assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(Outer.class));
    }

    @Test
    public void testNotARecord() {
        assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(String.class));
    }

    @Test
    public void testDiscriminatorWithStrictVariantIsRejected() {
        assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(Strict.class));
    }

    // ========================================================================
    // Null components
    // ========================================================================

    @Test
    public void testNullComponentsAreWrittenAsNull() {
        JsonCodec<Named> codec = RecordDerivation.codec(Named.class);

        assertEquals("{\"name\":null,\"count\":null,\"note\":null}", codec.toJson(new Named(null, null, null)));
        assertEquals(new Named(null, null, JsonNode.NULL), codec.decode("{\"name\":null,\"count\":null,\"note\":null}"));
        assertEquals(new Named("n", 2, JsonNode.TRUE), codec.decode(codec.toJson(new Named("n", 2, JsonNode.TRUE))));
    }

    @Test
    public void testNullComponentIsNotMissing() {
        JsonDecodeException e = assertThrows(JsonDecodeException.class,
            () -> RecordDerivation.decoder(Named.class).decode("{\"name\":null,\"note\":null}"));
        assertEquals(".count(missing)", e.getMessage());
    }

    // ========================================================================
    // Nested sums
    // ========================================================================

    @Test
    public void testNestedDiscriminatedSum() {
        JsonCodec<Vehicle> codec = RecordDerivation.codec(Vehicle.class);

        String json = codec.toJson(new Electric(75));
        assertEquals("{\"type\":\"Motor\",\"engine\":\"Electric\",\"kwh\":75}", json);
        assertEquals(new Electric(75), codec.decode(json));
        assertEquals(new Petrol(4), codec.decode("{\"cylinders\":4,\"engine\":\"Petrol\",\"type\":\"Motor\"}"));
        assertEquals(new Bike(21), codec.decode(codec.toJson(new Bike(21))));
    }

    @Test
    public void testNestedSumWithoutDiscriminatorIsRejected() {
        JsonDerivationException e = assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(Animal.class));
        assertTrue(e.getMessage().contains("needs a discriminator of its own"));
    }

    @Test
    public void testNestedSumWithSameDiscriminatorIsRejected() {
        assertThrows(JsonDerivationException.class, () -> RecordDerivation.codec(Plant.class));
    }
}
