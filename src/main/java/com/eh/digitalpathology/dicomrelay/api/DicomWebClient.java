/**
 * DicomWebClient talks to one DICOMweb endpoint (QIDO-RS search, WADO-RS retrieve and
 * STOW-RS store at study level). One instance exists per endpoint; all instances share the
 * pooled HTTP client declared in HttpClientConfig.
 */

package com.eh.digitalpathology.dicomrelay.api;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;
import com.eh.digitalpathology.dicomrelay.exceptions.DicomWebException;
import com.eh.digitalpathology.dicomrelay.model.StowResult;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import com.eh.digitalpathology.dicomrelay.multipart.MultipartTranscoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.util.List;

public class DicomWebClient {

    private static final Logger logger = LoggerFactory.getLogger( DicomWebClient.class );

    static final String FAILED_SOP_SEQUENCE = "00081198";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public DicomWebClient ( CloseableHttpClient httpClient, ObjectMapper objectMapper, String baseUrl ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = StringUtils.removeEnd( StringUtils.trimToEmpty( baseUrl ), "/" );
    }

    public String getBaseUrl ( ) {
        return baseUrl;
    }

    public ArrayNode searchStudies ( ) {
        String uri = baseUrl + "/studies";
        logger.debug( "searchStudies :: Querying {}", uri );
        HttpGet httpGet = new HttpGet( uri );
        httpGet.setHeader( HttpHeaders.ACCEPT, RelayConstants.APPLICATION_DICOM_JSON );
        try ( CloseableHttpResponse response = httpClient.execute( httpGet ) ) {
            int statusCode = response.getStatusLine( ).getStatusCode( );
            if ( statusCode == HttpStatus.SC_NO_CONTENT ) {
                return objectMapper.createArrayNode( );
            }
            if ( statusCode != HttpStatus.SC_OK ) {
                throw new DicomWebException( String.format( "Study search at %s failed: %s - %s", uri, statusCode, response.getStatusLine( ).getReasonPhrase( ) ), statusCode );
            }
            HttpEntity entity = response.getEntity( );
            if ( entity == null ) {
                return objectMapper.createArrayNode( );
            }
            JsonNode root = objectMapper.readTree( EntityUtils.toByteArray( entity ) );
            if ( root == null || root.isMissingNode( ) || root.isNull( ) ) {
                return objectMapper.createArrayNode( );
            }
            if ( !root.isArray( ) ) {
                throw new DicomWebException( "Study search at " + uri + " did not return a JSON array", statusCode );
            }
            return (ArrayNode) root;
        } catch ( IOException ex ) {
            throw new DicomWebException( "Failed to query studies at " + uri, ex );
        }
    }

    /**
     * WADO-RS retrieval of a whole study. A multipart answer is kept as received, body and
     * Content-Type untouched; a single-part {@code application/dicom} answer becomes a
     * one-instance payload.
     */
    public StudyPayload retrieveStudy ( String studyInstanceUid ) {
        String uri = baseUrl + "/studies/" + studyInstanceUid;
        logger.info( "retrieveStudy :: Retrieving study {} from {}", studyInstanceUid, uri );
        HttpGet httpGet = new HttpGet( uri );
        httpGet.setHeader( HttpHeaders.ACCEPT, RelayConstants.MULTIPART_RELATED_DICOM );
        try ( CloseableHttpResponse response = httpClient.execute( httpGet ) ) {
            int statusCode = response.getStatusLine( ).getStatusCode( );
            if ( statusCode != HttpStatus.SC_OK ) {
                throw new DicomWebException( String.format( "Retrieval of study %s failed: %s - %s", studyInstanceUid, statusCode, response.getStatusLine( ).getReasonPhrase( ) ), statusCode );
            }
            HttpEntity entity = response.getEntity( );
            byte[] body = entity == null ? new byte[ 0 ] : EntityUtils.toByteArray( entity );
            Header contentTypeHeader = response.getFirstHeader( HttpHeaders.CONTENT_TYPE );
            String contentType = contentTypeHeader == null ? null : contentTypeHeader.getValue( );
            logger.debug( "retrieveStudy :: Study {} returned {} bytes of {}", studyInstanceUid, body.length, contentType );
            if ( MultipartTranscoder.isMultipart( contentType ) ) {
                return StudyPayload.multipart( body, contentType );
            }
            if ( StringUtils.startsWithIgnoreCase( contentType, RelayConstants.APPLICATION_DICOM ) && body.length > 0 ) {
                return StudyPayload.instances( List.of( body ) );
            }
            throw new DicomWebException( "Unexpected Content-Type '" + contentType + "' retrieving study " + studyInstanceUid, statusCode );
        } catch ( IOException ex ) {
            throw new DicomWebException( "Failed to retrieve study " + studyInstanceUid + " from " + uri, ex );
        }
    }

    /**
     * STOW-RS store of a multipart body. 200 means every instance was stored, 202 means some
     * were refused (counted from the FailedSOPSequence when the response carries one); any other
     * status means nothing was stored.
     */
    public StowResult storeStudy ( byte[] body, String contentType ) {
        String uri = baseUrl + "/studies";
        logger.info( "storeStudy :: Storing {} bytes to {}", body.length, uri );
        HttpPost httpPost = new HttpPost( uri );
        httpPost.setHeader( HttpHeaders.ACCEPT, RelayConstants.APPLICATION_DICOM_JSON );
        httpPost.setEntity( new ByteArrayEntity( body, ContentType.parse( contentType ) ) );
        try ( CloseableHttpResponse response = httpClient.execute( httpPost ) ) {
            int statusCode = response.getStatusLine( ).getStatusCode( );
            HttpEntity entity = response.getEntity( );
            byte[] responseBody = entity == null ? new byte[ 0 ] : EntityUtils.toByteArray( entity );
            if ( statusCode == HttpStatus.SC_OK || statusCode == HttpStatus.SC_ACCEPTED ) {
                int failed = countFailedInstances( responseBody );
                if ( statusCode == HttpStatus.SC_ACCEPTED && failed == 0 ) {
                    // 202 always signals at least one refused instance
                    failed = 1;
                }
                logger.info( "storeStudy :: Store to {} answered {} with {} failed instances", uri, statusCode, failed );
                return new StowResult( statusCode, failed );
            }
            throw new DicomWebException( String.format( "Store to %s failed: %s - %s", uri, statusCode, response.getStatusLine( ).getReasonPhrase( ) ), statusCode );
        } catch ( IOException ex ) {
            throw new DicomWebException( "Failed to send study to " + uri, ex );
        }
    }

    private int countFailedInstances ( byte[] responseBody ) {
        if ( responseBody.length == 0 ) {
            return 0;
        }
        try {
            JsonNode root = objectMapper.readTree( responseBody );
            JsonNode failedSequence = root == null ? null : root.path( FAILED_SOP_SEQUENCE ).path( "Value" );
            return failedSequence != null && failedSequence.isArray( ) ? failedSequence.size( ) : 0;
        } catch ( IOException e ) {
            logger.debug( "countFailedInstances :: Store response is not DICOM JSON: {}", e.getMessage( ) );
            return 0;
        }
    }
}
