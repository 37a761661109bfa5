package org.aksw.refexp.ontology;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.InputStream;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.Sets;
import com.hp.hpl.jena.rdf.model.Model;
import com.hp.hpl.jena.rdf.model.ModelFactory;
import com.hp.hpl.jena.rdf.model.Resource;
import com.hp.hpl.jena.vocabulary.RDF;
import com.hp.hpl.jena.vocabulary.RDFS;

public class JenaOntologyTest {

	private static final String NS = "http://example.org/blocks#";

	private static JenaOntology ontology;

	@BeforeClass
	public static void init() throws IOException {
		try (InputStream in = JenaOntologyTest.class.getClassLoader().getResourceAsStream("blocks.rdf")) {
			ontology = JenaOntology.load(in, NS);
		}
	}

	@Test
	public void testMostSpecificType() throws Exception {
		assertEquals("Block", ontology.bestEntityType("block1"));
		assertEquals("Pyramid", ontology.bestEntityType("pyramid2"));
		// full URIs are accepted as well
		assertEquals("Table", ontology.bestEntityType(NS + "table1"));
		// answered from the cache
		assertEquals("Block", ontology.bestEntityType("block1"));
	}

	@Test(expected = OntologyException.class)
	public void testUnknownEntity() throws Exception {
		ontology.bestEntityType("sphere1");
	}

	@Test
	public void testEntitiesOfType() throws Exception {
		assertEquals(Sets.newHashSet("pyramid1", "pyramid2"), ontology.entitiesOfType("Pyramid"));
		assertEquals(Sets.newHashSet("block1"), ontology.entitiesOfType("Block"));
		assertEquals(Sets.newHashSet("block1", "pyramid1", "pyramid2", "table1"), ontology.entitiesOfType("Thing"));
		assertTrue(ontology.entitiesOfType("Sphere").isEmpty());
	}

	@Test
	public void testTiesAreBrokenByURI() throws Exception {
		Model model = ModelFactory.createDefaultModel();
		Resource cube = model.createResource(NS + "Cube");
		Resource box = model.createResource(NS + "Box");
		model.createResource(NS + "thing1").addProperty(RDF.type, cube).addProperty(RDF.type, box);
		assertEquals("Box", new JenaOntology(model, NS).bestEntityType("thing1"));
	}

	@Test
	public void testTransitiveSuperClassesAreDropped() throws Exception {
		Model model = ModelFactory.createDefaultModel();
		Resource animal = model.createResource(NS + "Animal");
		Resource mammal = model.createResource(NS + "Mammal").addProperty(RDFS.subClassOf, animal);
		Resource dog = model.createResource(NS + "Dog").addProperty(RDFS.subClassOf, mammal);
		model.createResource(NS + "rex").addProperty(RDF.type, animal).addProperty(RDF.type, dog);
		JenaOntology onto = new JenaOntology(model, NS);
		assertEquals("Dog", onto.bestEntityType("rex"));
		assertEquals(Sets.newHashSet("rex"), onto.entitiesOfType("Animal"));
	}
}
