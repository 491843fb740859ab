package com.questrail.opendrive.internal.decode;

import javax.xml.stream.XMLInputFactory;

/**
 * StAX input factory with DTD processing and external entity resolution disabled.
 *
 * <p>OpenDRIVE documents never need either, and both turn a parser into a
 * file-system and network client.</p>
 */
final class SecureXmlInputFactory
{
    private SecureXmlInputFactory() {
    }

    static XMLInputFactory create() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }
}
