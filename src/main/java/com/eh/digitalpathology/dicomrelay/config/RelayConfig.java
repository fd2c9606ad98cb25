package com.eh.digitalpathology.dicomrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@RefreshScope
@Configuration
@ConfigurationProperties( prefix = "relay" )
public class RelayConfig {

    public enum DiscoveryMode { QIDO_RS, ORTHANC_REST, C_FIND }

    public enum RetrievalMode { WADO_RS, C_MOVE }

    public enum DeliveryMode { STOW_RS, C_STORE, FOLDER }

    @DurationUnit( ChronoUnit.SECONDS )
    private Duration pollInterval = Duration.ofSeconds( 5 );
    @DurationUnit( ChronoUnit.SECONDS )
    private Duration maxBackoff = Duration.ofSeconds( 60 );
    @DurationUnit( ChronoUnit.SECONDS )
    private Duration moveQuiescence = Duration.ofSeconds( 2 );
    @DurationUnit( ChronoUnit.SECONDS )
    private Duration moveTimeout = Duration.ofSeconds( 60 );
    private boolean runOnce;
    private String studyUid;
    private String ledgerFile = "./received_dicom/.processed_studies.json";
    private boolean listenerEnabled = true;
    private Source source = new Source( );
    private Destination destination = new Destination( );
    private Http http = new Http( );

    public Duration getPollInterval ( ) {
        return pollInterval;
    }

    public void setPollInterval ( Duration pollInterval ) {
        this.pollInterval = pollInterval;
    }

    public Duration getMaxBackoff ( ) {
        return maxBackoff;
    }

    public void setMaxBackoff ( Duration maxBackoff ) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getMoveQuiescence ( ) {
        return moveQuiescence;
    }

    public void setMoveQuiescence ( Duration moveQuiescence ) {
        this.moveQuiescence = moveQuiescence;
    }

    public Duration getMoveTimeout ( ) {
        return moveTimeout;
    }

    public void setMoveTimeout ( Duration moveTimeout ) {
        this.moveTimeout = moveTimeout;
    }

    public boolean isRunOnce ( ) {
        return runOnce;
    }

    public void setRunOnce ( boolean runOnce ) {
        this.runOnce = runOnce;
    }

    public String getStudyUid ( ) {
        return studyUid;
    }

    public void setStudyUid ( String studyUid ) {
        this.studyUid = studyUid;
    }

    public String getLedgerFile ( ) {
        return ledgerFile;
    }

    public void setLedgerFile ( String ledgerFile ) {
        this.ledgerFile = ledgerFile;
    }

    public boolean isListenerEnabled ( ) {
        return listenerEnabled;
    }

    public void setListenerEnabled ( boolean listenerEnabled ) {
        this.listenerEnabled = listenerEnabled;
    }

    public Source getSource ( ) {
        return source;
    }

    public void setSource ( Source source ) {
        this.source = source;
    }

    public Destination getDestination ( ) {
        return destination;
    }

    public void setDestination ( Destination destination ) {
        this.destination = destination;
    }

    public Http getHttp ( ) {
        return http;
    }

    public void setHttp ( Http http ) {
        this.http = http;
    }

    public static class Source {
        private DiscoveryMode discovery = DiscoveryMode.QIDO_RS;
        private RetrievalMode retrieval = RetrievalMode.WADO_RS;
        private String dicomWebUrl;
        private String restUrl;
        private String host;
        private int port;
        private String aeTitle;

        public DiscoveryMode getDiscovery ( ) {
            return discovery;
        }

        public void setDiscovery ( DiscoveryMode discovery ) {
            this.discovery = discovery;
        }

        public RetrievalMode getRetrieval ( ) {
            return retrieval;
        }

        public void setRetrieval ( RetrievalMode retrieval ) {
            this.retrieval = retrieval;
        }

        public String getDicomWebUrl ( ) {
            return dicomWebUrl;
        }

        public void setDicomWebUrl ( String dicomWebUrl ) {
            this.dicomWebUrl = dicomWebUrl;
        }

        public String getRestUrl ( ) {
            return restUrl;
        }

        public void setRestUrl ( String restUrl ) {
            this.restUrl = restUrl;
        }

        public String getHost ( ) {
            return host;
        }

        public void setHost ( String host ) {
            this.host = host;
        }

        public int getPort ( ) {
            return port;
        }

        public void setPort ( int port ) {
            this.port = port;
        }

        public String getAeTitle ( ) {
            return aeTitle;
        }

        public void setAeTitle ( String aeTitle ) {
            this.aeTitle = aeTitle;
        }
    }

    public static class Destination {
        private DeliveryMode delivery = DeliveryMode.STOW_RS;
        private String dicomWebUrl;
        private String host;
        private int port;
        private String aeTitle;

        public DeliveryMode getDelivery ( ) {
            return delivery;
        }

        public void setDelivery ( DeliveryMode delivery ) {
            this.delivery = delivery;
        }

        public String getDicomWebUrl ( ) {
            return dicomWebUrl;
        }

        public void setDicomWebUrl ( String dicomWebUrl ) {
            this.dicomWebUrl = dicomWebUrl;
        }

        public String getHost ( ) {
            return host;
        }

        public void setHost ( String host ) {
            this.host = host;
        }

        public int getPort ( ) {
            return port;
        }

        public void setPort ( int port ) {
            this.port = port;
        }

        public String getAeTitle ( ) {
            return aeTitle;
        }

        public void setAeTitle ( String aeTitle ) {
            this.aeTitle = aeTitle;
        }
    }

    public static class Http {
        @DurationUnit( ChronoUnit.SECONDS )
        private Duration connectTimeout = Duration.ofSeconds( 30 );
        @DurationUnit( ChronoUnit.SECONDS )
        private Duration socketTimeout = Duration.ofSeconds( 120 );

        public Duration getConnectTimeout ( ) {
            return connectTimeout;
        }

        public void setConnectTimeout ( Duration connectTimeout ) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getSocketTimeout ( ) {
            return socketTimeout;
        }

        public void setSocketTimeout ( Duration socketTimeout ) {
            this.socketTimeout = socketTimeout;
        }
    }
}
