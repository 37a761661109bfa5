package org.aksw.refexp.lexicon;

public enum NumberAgreement {
	SINGULAR, PLURAL;
}
