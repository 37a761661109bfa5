package org.aksw.refexp.ontology;

import java.util.Set;

/**
 * Domain knowledge about the entities a document talks about.
 */
public interface Ontology {

	/**
	 * @return the most specific type of the entity
	 * @throws OntologyException if the entity is unknown or the lookup fails
	 */
	String bestEntityType(String entity) throws OntologyException;

	/**
	 * @return all entities of the given type, including those of its sub types
	 * @throws OntologyException if the lookup fails
	 */
	Set<String> entitiesOfType(String type) throws OntologyException;
}
