package org.aksw.refexp.ontology;

import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.collections4.map.LRUMap;
import org.apache.log4j.Logger;

import com.hp.hpl.jena.rdf.model.Model;
import com.hp.hpl.jena.rdf.model.ModelFactory;
import com.hp.hpl.jena.rdf.model.RDFNode;
import com.hp.hpl.jena.rdf.model.Resource;
import com.hp.hpl.jena.rdf.model.Statement;
import com.hp.hpl.jena.vocabulary.RDF;
import com.hp.hpl.jena.vocabulary.RDFS;

/**
 * Answers type lookups from an RDF model. Entities and types are named by their
 * URI relative to the namespace of the ontology, e.g. <code>block1</code> for
 * <code>http://example.org/blocks#block1</code>.
 * <p>
 * The model is assumed not to change after the ontology is created.
 */
public class JenaOntology implements Ontology {

	private static final Logger logger = Logger.getLogger(JenaOntology.class.getName());

	private static final Comparator<Resource> URI_ORDER = new Comparator<Resource>() {
		@Override
		public int compare(Resource r1, Resource r2) {
			return r1.getURI().compareTo(r2.getURI());
		}
	};

	private final Model model;
	private final String namespace;

	private LRUMap<String, String> entity2TypeCache = new LRUMap<String, String>(200);

	public JenaOntology(Model model, String namespace) {
		this.model = model;
		this.namespace = namespace;
	}

	/**
	 * Reads an RDF/XML document into a new model.
	 */
	public static JenaOntology load(InputStream in, String namespace) {
		Model model = ModelFactory.createDefaultModel();
		model.read(in, namespace, "RDF/XML");
		logger.debug("Loaded ontology with " + model.size() + " triples.");
		return new JenaOntology(model, namespace);
	}

	public Model getModel() {
		return model;
	}

	public String getNamespace() {
		return namespace;
	}

	@Override
	public synchronized String bestEntityType(String entity) throws OntologyException {
		String cached = entity2TypeCache.get(entity);
		if (cached != null) {
			return cached;
		}
		Resource resource = model.getResource(toURI(entity));
		List<Resource> types = new ArrayList<>();
		for (Statement st : model.listStatements(resource, RDF.type, (RDFNode) null).toList()) {
			if (st.getObject().isURIResource()) {
				types.add(st.getObject().asResource());
			}
		}
		if (types.isEmpty()) {
			throw new OntologyException("No type known for entity " + entity);
		}
		// drop every type that is a super class of another type of the entity
		List<Resource> mostSpecific = new ArrayList<>(types);
		for (Resource type : types) {
			for (Resource other : types) {
				if (!type.equals(other) && superClassesOf(other).contains(type)) {
					mostSpecific.remove(type);
					break;
				}
			}
		}
		if (mostSpecific.isEmpty()) {
			// cyclic hierarchy, all types are equivalent
			mostSpecific = types;
		}
		Collections.sort(mostSpecific, URI_ORDER);
		String type = toName(mostSpecific.get(0));
		logger.debug("Most specific type of " + entity + ": " + type);
		entity2TypeCache.put(entity, type);
		return type;
	}

	@Override
	public Set<String> entitiesOfType(String type) throws OntologyException {
		Set<String> entities = new TreeSet<>();
		for (Resource cls : subClassesOf(model.getResource(toURI(type)))) {
			for (Resource instance : model.listSubjectsWithProperty(RDF.type, cls).toList()) {
				if (instance.isURIResource()) {
					entities.add(toName(instance));
				}
			}
		}
		return entities;
	}

	/**
	 * @return the transitive super classes of the class, excluding the class itself unless it is on a cycle
	 */
	private Set<Resource> superClassesOf(Resource cls) {
		Set<Resource> visited = new HashSet<>();
		Deque<Resource> todo = new ArrayDeque<>();
		todo.add(cls);
		while (!todo.isEmpty()) {
			Resource current = todo.poll();
			for (Statement st : model.listStatements(current, RDFS.subClassOf, (RDFNode) null).toList()) {
				RDFNode object = st.getObject();
				if (object.isResource() && visited.add(object.asResource())) {
					todo.add(object.asResource());
				}
			}
		}
		return visited;
	}

	/**
	 * @return the class and its transitive sub classes
	 */
	private Set<Resource> subClassesOf(Resource cls) {
		Set<Resource> visited = new HashSet<>();
		Deque<Resource> todo = new ArrayDeque<>();
		visited.add(cls);
		todo.add(cls);
		while (!todo.isEmpty()) {
			Resource current = todo.poll();
			for (Resource sub : model.listSubjectsWithProperty(RDFS.subClassOf, current).toList()) {
				if (visited.add(sub)) {
					todo.add(sub);
				}
			}
		}
		return visited;
	}

	private String toURI(String name) {
		return name.startsWith(namespace) ? name : namespace + name;
	}

	private String toName(Resource resource) {
		String uri = resource.getURI();
		if (uri.startsWith(namespace)) {
			return uri.substring(namespace.length());
		}
		return resource.getLocalName();
	}
}
