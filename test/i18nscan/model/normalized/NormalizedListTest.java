package i18nscan.model.normalized;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

public class NormalizedListTest {

	private static StringPrimitive s(String value) {
		return new StringPrimitive(value);
	}

	@Test
	public void testFlattenIsDeep() {
		NormalizedList nested = NormalizedList.of(s("a"),
				NormalizedList.of(NormalizedList.empty(), NormalizedList.of(s("b"), NormalizedList.of(s("c")))),
				s("d"));
		assertThat(nested.flatten(), is(NormalizedList.of(s("a"), s("b"), s("c"), s("d"))));
		assertThat(nested.size(), is(3));
	}

	@Test
	public void testFlattenLeavesMappingsAlone() {
		Map<Normalized, Normalized> entries = new LinkedHashMap<>();
		entries.put(new SymbolPrimitive("list"), NormalizedList.of(s("x"), NormalizedList.of(s("y"))));
		MappingPrimitive mapping = new MappingPrimitive(entries);

		NormalizedList flat = NormalizedList.flatten(Arrays.<Normalized>asList(NormalizedList.of(mapping)));
		assertThat(flat.getElements(), is(Collections.<Normalized>singletonList(mapping)));
		assertThat(mapping.get(new SymbolPrimitive("list")).getShape(), is(Normalized.Shape.LIST));
	}

	@Test
	public void testFlattenOfNothing() {
		assertTrue(NormalizedList.flatten(Collections.<Normalized>emptyList()).isEmpty());
		assertTrue(NormalizedList.of(NormalizedList.empty(), NormalizedList.empty()).flatten().isEmpty());
	}

	@Test
	public void testPrimitiveEquality() {
		assertEquals(new DecimalPrimitive(new BigDecimal("1.50")), new DecimalPrimitive(new BigDecimal("1.5")));
		assertEquals(new DecimalPrimitive(new BigDecimal("1.50")).hashCode(),
				new DecimalPrimitive(new BigDecimal("1.5")).hashCode());
		assertEquals(new IntegerPrimitive(BigInteger.TEN), new IntegerPrimitive(BigInteger.TEN));
		assertNotEquals(new StringPrimitive("x"), new SymbolPrimitive("x"));
	}

	@Test
	public void testShapes() {
		assertThat(NormalizedList.empty().getShape(), is(Normalized.Shape.LIST));
		assertThat(s("x").getShape(), is(Normalized.Shape.PRIMITIVE));
		assertThat(MappingPrimitive.empty().getShape(), is(Normalized.Shape.PRIMITIVE));
	}

}
